/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.fleetrun.client;

import dev.mars.fleetrun.config.FleetRunConfiguration;
import io.vertx.core.Vertx;

/**
 * Service provider for {@link AgentClient} implementations, located with
 * {@link java.util.ServiceLoader} by the command line entry point.
 *
 * <p>Register implementations in
 * {@code META-INF/services/dev.mars.fleetrun.client.AgentClientProvider}.</p>
 */
public interface AgentClientProvider {

    /**
     * Short name used in log output and diagnostics.
     */
    String name();

    AgentClient create(Vertx vertx, FleetRunConfiguration configuration);
}

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

package dev.mars.fleetrun.cli;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampedProgressSinkTest {

    @Test
    void prefixesMessagesWithFormattedTimestamp() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        TimestampedProgressSink sink = new TimestampedProgressSink(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), "yyyy-MM-dd HH:mm:ss", ZoneOffset.UTC);

        sink.emit(Instant.parse("2026-10-17T09:15:30Z"), "Admitted web1 (1 of 3)");

        assertThat(buffer.toString(StandardCharsets.UTF_8).trim())
                .isEqualTo("2026-10-17 09:15:30: Admitted web1 (1 of 3)");
    }
}

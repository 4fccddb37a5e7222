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

import dev.mars.fleetrun.client.ProgressSink;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Prints progress lines as {@code <timestamp>: <message>}.
 */
public class TimestampedProgressSink implements ProgressSink {

    private final PrintStream out;
    private final DateTimeFormatter formatter;

    public TimestampedProgressSink(PrintStream out, String pattern, ZoneId zone) {
        this.out = out;
        this.formatter = DateTimeFormatter.ofPattern(pattern).withZone(zone);
    }

    @Override
    public void emit(Instant timestamp, String message) {
        synchronized (out) {
            out.println(formatter.format(timestamp) + ": " + message);
        }
    }
}

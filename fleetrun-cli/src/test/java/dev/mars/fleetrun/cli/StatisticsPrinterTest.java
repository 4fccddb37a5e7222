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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.fleetrun.core.AgentStats;
import dev.mars.fleetrun.core.RunStatistics;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatisticsPrinterTest {

    private static final Instant START = Instant.parse("2026-10-17T09:00:00Z");

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static RunStatistics.Builder fiveNodes() {
        return RunStatistics.builder()
                .total(5)
                .dispatched(5)
                .startTime(START)
                .endTime(START.plusMillis(12_340));
    }

    @Test
    void textSummary() throws Exception {
        RunStatistics statistics = fiveNodes()
                .succeeded(3)
                .failed(1)
                .timedOut(1)
                .failedNodes(List.of("db1"))
                .timedOutNodes(List.of("web3"))
                .build();

        new StatisticsPrinter(out, false).print(statistics, new AgentStats(4, 1, Duration.ofSeconds(12)));

        assertThat(output())
                .contains("Finished processing 5 / 5 nodes in 12.34 s")
                .contains("   Succeeded: 3")
                .contains("      Failed: 1 (db1)")
                .contains("   Timed out: 1 (web3)")
                .contains("Agent client: 4 ok, 1 failed")
                .doesNotContain("Skipped")
                .doesNotContain("cancelled");
    }

    @Test
    void cancelledRunShowsSkippedNodes() throws Exception {
        RunStatistics statistics = fiveNodes().dispatched(2).succeeded(2).skipped(3).cancelled(true).build();

        new StatisticsPrinter(out, false).print(statistics, null);

        assertThat(output())
                .contains("Finished processing 2 / 5 nodes")
                .contains("     Skipped: 3")
                .contains("Run was cancelled")
                .doesNotContain("Agent client");
    }

    @Test
    void jsonDocument() throws Exception {
        RunStatistics statistics = fiveNodes().succeeded(4).failed(1).failedNodes(List.of("db1")).build();

        new StatisticsPrinter(out, true).print(statistics, new AgentStats(4, 1, Duration.ofSeconds(12)));

        JsonNode document = new ObjectMapper().readTree(output());
        assertThat(document.path("statistics").path("total").asInt()).isEqualTo(5);
        assertThat(document.path("statistics").path("failed").asInt()).isEqualTo(1);
        assertThat(document.path("statistics").path("successful").asBoolean()).isFalse();
        assertThat(document.path("statistics").path("failedNodes").get(0).asText()).isEqualTo("db1");
        assertThat(document.path("statistics").path("startTime").asText()).isEqualTo("2026-10-17T09:00:00Z");
        assertThat(document.path("agentStats").path("okCount").asLong()).isEqualTo(4);
    }
}

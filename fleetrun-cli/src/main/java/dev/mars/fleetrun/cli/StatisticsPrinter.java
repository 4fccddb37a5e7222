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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.fleetrun.core.AgentStats;
import dev.mars.fleetrun.core.RunStatistics;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the final run summary, either as aligned text or as JSON.
 */
public class StatisticsPrinter {

    private final PrintStream out;
    private final boolean json;
    private final ObjectMapper objectMapper;

    public StatisticsPrinter(PrintStream out, boolean json) {
        this.out = out;
        this.json = json;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void print(RunStatistics statistics, AgentStats agentStats) throws JsonProcessingException {
        if (json) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("statistics", statistics);
            document.put("agentStats", agentStats);
            out.println(objectMapper.writeValueAsString(document));
            return;
        }

        out.println();
        out.printf(Locale.ROOT, "Finished processing %d / %d nodes in %.2f s%n",
                statistics.getCompleted(), statistics.getTotal(), statistics.getElapsed().toMillis() / 1000.0);
        out.printf("   Succeeded: %d%n", statistics.getSucceeded());
        out.printf("      Failed: %d%s%n", statistics.getFailed(), listOf(statistics.getFailedNodes()));
        out.printf("   Timed out: %d%s%n", statistics.getTimedOut(), listOf(statistics.getTimedOutNodes()));
        if (statistics.getSkipped() > 0) {
            out.printf("     Skipped: %d%n", statistics.getSkipped());
        }
        if (statistics.isCancelled()) {
            out.println("   Run was cancelled before all nodes were processed");
        }
        if (agentStats != null) {
            out.printf("Agent client: %d ok, %d failed%n", agentStats.getOkCount(), agentStats.getFailCount());
        }
    }

    private static String listOf(List<String> nodes) {
        return nodes.isEmpty() ? "" : " (" + String.join(", ", nodes) + ")";
    }
}

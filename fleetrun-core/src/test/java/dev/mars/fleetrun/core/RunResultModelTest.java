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

package dev.mars.fleetrun.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.fleetrun.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunResultModelTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    @Test
    void runStatisticsSerializeWithIsoTimes() throws Exception {
        Instant start = Instant.parse("2026-10-17T10:00:00Z");
        RunStatistics stats = RunStatistics.builder()
                .total(3).dispatched(3).succeeded(2).failed(1)
                .startTime(start).endTime(start.plusSeconds(90))
                .failedNodes(List.of("db-01"))
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(stats));

        assertThat(json.get("total").asInt()).isEqualTo(3);
        assertThat(json.get("failed").asInt()).isEqualTo(1);
        assertThat(json.get("successful").asBoolean()).isFalse();
        assertThat(json.get("startTime").asText()).isEqualTo("2026-10-17T10:00:00Z");
        assertThat(json.get("elapsed").asText()).isEqualTo("PT1M30S");
        assertThat(json.get("failedNodes").get(0).asText()).isEqualTo("db-01");
    }

    @Test
    void commandDescriptorReadsFromJson() throws Exception {
        String json = "{\"action\":\"runonce\",\"arguments\":{\"noop\":true,\"tags\":\"web,db\"},\"extra\":1}";

        CommandDescriptor command = objectMapper.readValue(json, CommandDescriptor.class);

        assertThat(command.getAction()).isEqualTo(CommandDescriptor.RUN_ONCE);
        assertThat(command.getArgument("noop")).contains(true);
        assertThat(command.getArgument("tags")).contains("web,db");
        assertThat(command.getArgument("server")).isEmpty();
    }

    @Test
    void configurationErrorsRenderTheirMessages() {
        assertThat(ConfigurationError.of(ConfigurationError.Kind.UNKNOWN_COMMAND, "status").getMessage())
                .isEqualTo("Do not know how to handle the 'status' command");
        assertThat(ConfigurationError.of(ConfigurationError.Kind.SPLAY_WITH_FORCE).getMessage())
                .isEqualTo("Cannot set splay when forcing runs");
    }

    @Test
    void configurationExceptionJoinsErrorMessages() {
        ValidationResult result = new ValidationResult();
        result.addError(ConfigurationError.Kind.SPLAY_WITH_FORCE);
        result.addError(ConfigurationError.Kind.SPLAYLIMIT_WITH_FORCE);

        ConfigurationException e = new ConfigurationException(result);

        assertThat(e.getMessage())
                .isEqualTo("Cannot set splay when forcing runs; Cannot set splaylimit when forcing runs");
        assertThat(e.getErrors()).hasSize(2);
        assertThatThrownBy(() -> new ConfigurationException(ValidationResult.valid()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outcomesAndResponsesExposeTheirDetail() {
        assertThat(TriggerResponse.rejected("disabled").getReason()).contains("disabled");
        assertThat(TriggerResponse.accepted().isAccepted()).isTrue();
        assertThat(NodeOutcome.failed("exit 4").getMessage()).contains("exit 4");
        assertThat(NodeOutcome.succeeded().getPayload()).isEmpty();
    }
}

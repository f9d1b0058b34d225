package com.scholary.audiobook.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.checkpoint.CheckpointStore;
import com.scholary.audiobook.export.AudioExporter;
import com.scholary.audiobook.testutil.RecordingAudioExporter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end test of the HTTP API with the mock backend.
 *
 * <p>The encoder is replaced by {@link RecordingAudioExporter} so no ffmpeg is needed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SynthesisApiIntegrationTest {

  @Autowired private TestRestTemplate restTemplate;
  @Autowired private ObjectMapper objectMapper;

  @TempDir Path tempDir;

  @TestConfiguration
  static class ExporterConfig {
    @Bean
    @Primary
    AudioExporter recordingAudioExporter() {
      return new RecordingAudioExporter();
    }
  }

  @Test
  void synthesize_shouldCompleteJobAndExposeEventStream() throws Exception {
    Path output = tempDir.resolve("book.mp3");
    Map<String, Object> request =
        Map.of(
            "chapters",
            List.of(
                Map.of("title", "One", "text", "It was a bright cold day in April."),
                Map.of("title", "Two", "text", "The clocks were striking thirteen.")),
            "outputPath",
            output.toString(),
            "checkpoint",
            true);

    JsonNode status = submitAndAwait(request);

    assertThat(status.get("status").asText()).isEqualTo("COMPLETED");
    assertThat(status.get("progress").asInt()).isEqualTo(100);
    assertThat(status.get("phase").asText()).isEqualTo("DONE");
    assertThat(status.path("result").get("totalChunks").asInt()).isEqualTo(2);
    assertThat(output).exists();
    assertThat(CheckpointStore.directoryFor(output)).doesNotExist();

    List<String> lines = events(status.get("jobId").asText());
    assertThat(lines)
        .containsSubsequence(
            "METADATA:backend_resolved:mock",
            "PHASE:PARSING",
            "PHASE:INFERENCE",
            "CHECKPOINT:SAVED:0",
            "PROGRESS:2/2 chunks",
            "CHECKPOINT:CLEANED",
            "PHASE:DONE",
            "DONE");
  }

  @Test
  void synthesize_shouldEmitJsonEventsWhenRequested() throws Exception {
    Map<String, Object> request =
        Map.of(
            "chapters",
            List.of(Map.of("text", "Short text.")),
            "outputPath",
            tempDir.resolve("json.mp3").toString(),
            "eventFormat",
            "json");

    JsonNode status = submitAndAwait(request);

    List<String> lines = events(status.get("jobId").asText());
    JsonNode last = objectMapper.readTree(lines.get(lines.size() - 1));
    assertThat(last.get("type").asText()).isEqualTo("done");
    assertThat(last.get("job_id").asText()).isEqualTo(status.get("jobId").asText());
    assertThat(last.get("chunks").asInt()).isEqualTo(1);
  }

  @Test
  void probeOnly_shouldReportMissingCheckpoint() throws Exception {
    Map<String, Object> request =
        Map.of(
            "chapters",
            List.of(Map.of("text", "Anything.")),
            "outputPath",
            tempDir.resolve("probe.mp3").toString(),
            "probeOnly",
            true);

    JsonNode status = submitAndAwait(request);

    assertThat(status.get("status").asText()).isEqualTo("COMPLETED");
    assertThat(status.path("probe").get("status").asText()).isEqualTo("NONE");
    assertThat(events(status.get("jobId").asText())).containsExactly("CHECKPOINT:NONE");
  }

  @Test
  void getJobStatus_shouldReturn404ForUnknownJob() {
    ResponseEntity<JsonNode> response =
        restTemplate.getForEntity("/api/jobs/does-not-exist", JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().get("code").asText()).isEqualTo("JOB_NOT_FOUND");
  }

  private JsonNode submitAndAwait(Map<String, Object> request) {
    ResponseEntity<JsonNode> accepted =
        restTemplate.postForEntity("/api/audiobooks", request, JsonNode.class);
    assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    String statusUrl = accepted.getBody().get("statusUrl").asText();

    await()
        .atMost(Duration.ofSeconds(30))
        .pollInterval(Duration.ofMillis(100))
        .until(
            () -> {
              String state =
                  restTemplate.getForObject(statusUrl, JsonNode.class).get("status").asText();
              return state.equals("COMPLETED") || state.equals("FAILED");
            });
    return restTemplate.getForObject(statusUrl, JsonNode.class);
  }

  private List<String> events(String jobId) {
    JsonNode page = restTemplate.getForObject("/api/jobs/" + jobId + "/events", JsonNode.class);
    assertThat(page.get("finished").asBoolean()).isTrue();
    List<String> lines = new ArrayList<>();
    page.get("lines").forEach(line -> lines.add(line.asText()));
    return lines;
  }
}

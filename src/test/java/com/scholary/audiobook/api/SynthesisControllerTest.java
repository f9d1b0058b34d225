package com.scholary.audiobook.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.audiobook.api.JobStatusResponse.Status;
import com.scholary.audiobook.backend.BackendType;
import com.scholary.audiobook.config.SynthesisProperties;
import com.scholary.audiobook.events.EventLine;
import com.scholary.audiobook.export.OutputFormat;
import com.scholary.audiobook.job.JobNotFoundException;
import com.scholary.audiobook.job.JobRepository;
import com.scholary.audiobook.job.SynthesisJob;
import com.scholary.audiobook.pipeline.FailureKind;
import com.scholary.audiobook.pipeline.PipelineMode;
import com.scholary.audiobook.service.SynthesisJobRunner;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SynthesisControllerTest {

  private MockMvc mockMvc;

  @Mock private SynthesisJobRunner jobRunner;
  @Mock private JobRepository jobRepository;

  @BeforeEach
  void setUp() {
    SynthesisController controller =
        new SynthesisController(jobRunner, jobRepository, properties());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void synthesize_shouldAcceptJobAndStartRunner() throws Exception {
    mockMvc
        .perform(
            post("/api/audiobooks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"chapters": [{"title": "One", "text": "Hello."}],
                     "outputPath": "/tmp/book.mp3",
                     "backend": "MOCK",
                     "format": "mp3",
                     "pipelineMode": "overlap3"}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty())
        .andExpect(jsonPath("$.statusUrl").value(startsWith("/api/jobs/")));

    ArgumentCaptor<SynthesisJob> job = ArgumentCaptor.forClass(SynthesisJob.class);
    verify(jobRunner).run(job.capture());
    verify(jobRepository).save(job.getValue());
    assertThat(job.getValue().getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getValue().getRequest().backend()).isEqualTo(BackendType.MOCK);
    assertThat(job.getValue().getRequest().pipelineMode()).isEqualTo(PipelineMode.OVERLAP3);
  }

  @Test
  void synthesize_shouldRejectMissingChaptersAndBadBitrate() throws Exception {
    mockMvc
        .perform(
            post("/api/audiobooks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"chapters\": [], \"outputPath\": \"/tmp/b.mp3\","
                        + " \"bitrate\": \"64k\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
        .andExpect(jsonPath("$.details.length()").value(2));

    verify(jobRunner, never()).run(any());
  }

  @Test
  void synthesize_shouldRejectUnknownBackend() throws Exception {
    mockMvc
        .perform(
            post("/api/audiobooks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"chapters\": [{\"text\": \"Hi\"}], \"outputPath\": \"/tmp/b.mp3\","
                        + " \"backend\": \"cuda\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
  }

  @Test
  void getJobStatus_shouldReportFailure() throws Exception {
    SynthesisJob job = new SynthesisJob("job-1", null, 10);
    job.setStatus(Status.FAILED);
    job.setFailureKind(FailureKind.BACKEND);
    job.setError("mlx backend is not reachable");
    when(jobRepository.getById("job-1")).thenReturn(job);

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.failureKind").value("BACKEND"))
        .andExpect(jsonPath("$.error").value("mlx backend is not reachable"))
        .andExpect(jsonPath("$.eventsUrl").value("/api/jobs/job-1/events"));
  }

  @Test
  void getJobStatus_shouldReturn404ForUnknownJob() throws Exception {
    when(jobRepository.getById("missing")).thenThrow(new JobNotFoundException("missing"));

    mockMvc
        .perform(get("/api/jobs/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("JOB_NOT_FOUND"))
        .andExpect(jsonPath("$.path").value("/api/jobs/missing"));
  }

  @Test
  void getJobEvents_shouldPageFromOffset() throws Exception {
    SynthesisJob job = new SynthesisJob("job-1", null, 10);
    job.getEvents().accept(new EventLine("phase", "PHASE:PARSING", false, Map.of()));
    job.getEvents().accept(new EventLine("phase", "PHASE:INFERENCE", false, Map.of()));
    job.getEvents().accept(new EventLine("progress", "PROGRESS:1/2 chunks", false, Map.of()));
    job.setStatus(Status.PROCESSING);
    when(jobRepository.getById("job-1")).thenReturn(job);

    mockMvc
        .perform(get("/api/jobs/job-1/events").param("from", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.lines.length()").value(2))
        .andExpect(jsonPath("$.lines[0]").value("PHASE:INFERENCE"))
        .andExpect(jsonPath("$.nextOffset").value(3))
        .andExpect(jsonPath("$.finished").value(false));
  }

  private static SynthesisProperties properties() {
    return new SynthesisProperties(
        new SynthesisProperties.Defaults(
            "af_heart",
            1.0,
            "a",
            BackendType.AUTO,
            "\\n+",
            OutputFormat.MP3,
            "192k",
            false,
            PipelineMode.SEQUENTIAL,
            2,
            32),
        "/tmp/audiobook-synth",
        5,
        100,
        null,
        1,
        5);
  }
}

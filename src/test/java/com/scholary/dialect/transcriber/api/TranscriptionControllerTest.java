package com.scholary.dialect.transcriber.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.dialect.transcriber.audio.AudioFormatException;
import com.scholary.dialect.transcriber.audio.AudioSource;
import com.scholary.dialect.transcriber.audio.EmptyAudioException;
import com.scholary.dialect.transcriber.chunking.ChunkBoundary;
import com.scholary.dialect.transcriber.config.PipelineConfig;
import com.scholary.dialect.transcriber.correction.CorrectionTier;
import com.scholary.dialect.transcriber.job.TranscriptionJob;
import com.scholary.dialect.transcriber.job.TranscriptionJobService;
import com.scholary.dialect.transcriber.objectstore.ObjectStoreException;
import com.scholary.dialect.transcriber.service.CancellationToken;
import com.scholary.dialect.transcriber.service.PipelineOrchestrator;
import com.scholary.dialect.transcriber.transcript.PipelineMetadata;
import com.scholary.dialect.transcriber.transcript.PipelineOutput;
import com.scholary.dialect.transcriber.transcript.TranscriptionSegment;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(TranscriptionController.class)
@Import(TranscriptionControllerTest.DefaultPipelineConfig.class)
class TranscriptionControllerTest {

  static final PipelineConfig DEFAULTS =
      new PipelineConfig(20.0, 2.0, 0.3, 0.9, 0.7, "arb", 16000);

  @TestConfiguration
  static class DefaultPipelineConfig {
    @Bean
    PipelineConfig defaultPipelineConfig() {
      return DEFAULTS;
    }
  }

  @Autowired private MockMvc mockMvc;

  @MockBean private PipelineOrchestrator orchestrator;
  @MockBean private TranscriptionJobService jobService;

  private static final String FILE_REQUEST = "{\"path\": \"/data/call.wav\"}";

  @Test
  void transcribe_returnsPipelineOutput() throws Exception {
    TranscriptionSegment segment =
        new TranscriptionSegment(0, "ezayak", "ezayak?", 0.95, CorrectionTier.AUTO, true, 0, 20);
    when(orchestrator.processAudio(eq(AudioSource.ofFile("/data/call.wav")), eq(DEFAULTS)))
        .thenReturn(
            new PipelineOutput(
                "ezayak",
                "ezayak?",
                List.of(segment),
                new PipelineMetadata(3, 45.0, 120L, 1, 2, 0, false, "arb")));

    mockMvc
        .perform(
            post("/v1/transcribe").contentType(MediaType.APPLICATION_JSON).content(FILE_REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fullRawText").value("ezayak"))
        .andExpect(jsonPath("$.fullCorrectedText").value("ezayak?"))
        .andExpect(jsonPath("$.segments", hasSize(1)))
        .andExpect(jsonPath("$.segments[0].tier").value("AUTO"))
        .andExpect(jsonPath("$.segments[0].needsReview").value(true))
        .andExpect(jsonPath("$.metadata.droppedCount").value(2));
  }

  @Test
  void transcribe_appliesRequestOverrides() throws Exception {
    PipelineConfig expected = new PipelineConfig(10.0, 1.0, 0.5, 0.9, 0.7, "arz", 16000);
    when(orchestrator.processAudio(eq(AudioSource.ofObject("calls", "a.wav")), eq(expected)))
        .thenReturn(
            new PipelineOutput(
                "", "", List.of(), new PipelineMetadata(0, 0, 0, 0, 0, 0, false, "arz")));

    mockMvc
        .perform(
            post("/v1/transcribe")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"bucket\": \"calls\", \"key\": \"a.wav\", \"chunkDurationSec\": 10,"
                        + " \"overlapSec\": 1, \"admissionConfidenceThreshold\": 0.5,"
                        + " \"targetLanguage\": \"arz\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.metadata.targetLanguage").value("arz"));
  }

  @Test
  void transcribe_unreadableAudioIs422() throws Exception {
    when(orchestrator.processAudio(any(AudioSource.class), any(PipelineConfig.class)))
        .thenThrow(new AudioFormatException("Unsupported audio format"));

    mockMvc
        .perform(
            post("/v1/transcribe").contentType(MediaType.APPLICATION_JSON).content(FILE_REQUEST))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errorCode").value("AudioFormatException"))
        .andExpect(jsonPath("$.details").value("Unsupported audio format"));
  }

  @Test
  void transcribe_emptyAudioIs422() throws Exception {
    when(orchestrator.processAudio(any(AudioSource.class), any(PipelineConfig.class)))
        .thenThrow(new EmptyAudioException("Audio contains no samples"));

    mockMvc
        .perform(
            post("/v1/transcribe").contentType(MediaType.APPLICATION_JSON).content(FILE_REQUEST))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.errorCode").value("EmptyAudioException"));
  }

  @Test
  void transcribe_objectStoreFailureIs502() throws Exception {
    when(orchestrator.processAudio(any(AudioSource.class), any(PipelineConfig.class)))
        .thenThrow(new ObjectStoreException("Object not found: bucket=calls, key=a.wav"));

    mockMvc
        .perform(
            post("/v1/transcribe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"bucket\": \"calls\", \"key\": \"a.wav\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.errorCode").value("ObjectStoreException"));
  }

  @Test
  void transcribe_badSettingsAre400() throws Exception {
    mockMvc
        .perform(
            post("/v1/transcribe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/data/call.wav\", \"overlapSec\": 25}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("ConfigurationException"))
        .andExpect(jsonPath("$.details", containsString("smaller than chunk duration")));

    mockMvc
        .perform(post("/v1/transcribe").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("IllegalArgumentException"));

    mockMvc
        .perform(
            post("/v1/transcribe")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/data/call.wav\", \"chunkDurationSec\": -5}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void previewChunks_rejectsChunkDurationsOutsideBounds() throws Exception {
    mockMvc
        .perform(
            post("/v1/chunks/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/data/call.wav\", \"chunkDurationSec\": 0.001}"))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            post("/v1/chunks/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\": \"/data/call.wav\", \"chunkDurationSec\": 1000000000}"))
        .andExpect(status().isBadRequest());

    verify(orchestrator, never()).previewChunks(any(AudioSource.class), any(PipelineConfig.class));
  }

  @Test
  void transcribeStream_writesOneSegmentPerLine() throws Exception {
    when(orchestrator.streamAudio(
            any(AudioSource.class), any(PipelineConfig.class), any(CancellationToken.class)))
        .thenReturn(
            Stream.of(
                new TranscriptionSegment(0, "one", "one.", 0.95, CorrectionTier.AUTO, true, 0, 20),
                new TranscriptionSegment(
                    2, "three", "three.", 0.75, CorrectionTier.SUGGEST, false, 36, 45)));

    MvcResult started =
        mockMvc
            .perform(
                post("/v1/transcribe/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(FILE_REQUEST))
            .andExpect(request().asyncStarted())
            .andReturn();

    String body =
        mockMvc
            .perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();

    String[] lines = body.split("\n");
    assertThat(lines).hasSize(2);
    assertThat(lines[0]).contains("\"rawText\":\"one\"");
    assertThat(lines[1]).contains("\"index\":2");
  }

  @Test
  void transcribeStream_fatalErrorBeforeStreamingIs422() throws Exception {
    when(orchestrator.streamAudio(
            any(AudioSource.class), any(PipelineConfig.class), any(CancellationToken.class)))
        .thenThrow(new EmptyAudioException("Audio contains no samples"));

    mockMvc
        .perform(
            post("/v1/transcribe/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content(FILE_REQUEST))
        .andExpect(status().isUnprocessableEntity());
  }

  @Test
  void submitJob_returns202WithStatusUrl() throws Exception {
    TranscriptionJob job = new TranscriptionJob("job-1", "/data/call.wav");
    when(jobService.submit(any(TranscriptionRequest.class))).thenReturn(job);

    mockMvc
        .perform(post("/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(FILE_REQUEST))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.statusUrl").value("/v1/jobs/job-1"));
  }

  @Test
  void submitJob_fullQueueIs503() throws Exception {
    when(jobService.submit(any(TranscriptionRequest.class)))
        .thenThrow(new TaskRejectedException("queue full"));

    mockMvc
        .perform(post("/v1/jobs").contentType(MediaType.APPLICATION_JSON).content(FILE_REQUEST))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void getJobStatus_returnsStatusOrNotFound() throws Exception {
    TranscriptionJob job = new TranscriptionJob("job-2", "/data/call.wav");
    job.updateProgress(1, 4);
    when(jobService.find("job-2")).thenReturn(Optional.of(job));
    when(jobService.find("nope")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/jobs/job-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.source").value("/data/call.wav"))
        .andExpect(jsonPath("$.createdAt").exists())
        .andExpect(jsonPath("$.progress").value(25))
        .andExpect(jsonPath("$.totalChunks").value(4));

    mockMvc.perform(get("/v1/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void cancelJob_returns202OrNotFound() throws Exception {
    TranscriptionJob job = new TranscriptionJob("job-3", "/data/call.wav");
    when(jobService.cancel("job-3")).thenReturn(Optional.of(job));
    when(jobService.cancel("nope")).thenReturn(Optional.empty());

    mockMvc
        .perform(delete("/v1/jobs/job-3"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-3"));

    mockMvc.perform(delete("/v1/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void previewChunks_returnsBoundaries() throws Exception {
    when(orchestrator.previewChunks(any(AudioSource.class), eq(DEFAULTS)))
        .thenReturn(
            List.of(
                new ChunkBoundary(0, 0, 320000, 0.0, 20.0),
                new ChunkBoundary(1, 288000, 608000, 18.0, 38.0),
                new ChunkBoundary(2, 576000, 720000, 36.0, 45.0)));

    mockMvc
        .perform(
            post("/v1/chunks/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content(FILE_REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.chunkCount").value(3))
        .andExpect(jsonPath("$.totalDurationSeconds").value(45.0))
        .andExpect(jsonPath("$.chunks[1].startSeconds").value(18.0))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON));
  }
}

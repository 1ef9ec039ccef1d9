package com.openshaz.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openshaz.api.service.AudioJobService;
import com.openshaz.common.config.RabbitMQConfig;
import com.openshaz.common.exception.JobFailedException;
import com.openshaz.common.exception.RpcTimeoutException;
import com.openshaz.common.message.JobResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AudioController.class)
class AudioControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AudioJobService audioJobService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final String BUCKET_URL = "http://minio:9000/opensource-songs/00001.wav";
    private static final String QUERY_URL = "http://minio:9000/query-songs/query.wav";

    private final MockMultipartFile song = new MockMultipartFile("file", "00001.wav", "audio/wav", "RIFF".getBytes());
    private final MockMultipartFile query = new MockMultipartFile("file", "query.wav", "audio/wav", "RIFF".getBytes());

    @Test
    @DisplayName("Should report healthy")
    void health_shouldReturnOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("healthy"));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // /add-song
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should queue the extraction and answer 202 by default")
    void addSong_shouldQueueByDefault() throws Exception {
        when(audioJobService.uploadReferenceSong(any())).thenReturn(BUCKET_URL);
        when(audioJobService.sendExtractionTaskAsync("00001.wav", BUCKET_URL)).thenReturn("job-1");

        mockMvc.perform(multipart("/add-song").file(song))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value(202))
                .andExpect(jsonPath("$.data.music_name").value("00001.wav"))
                .andExpect(jsonPath("$.data.bucket_url").value(BUCKET_URL))
                .andExpect(jsonPath("$.data.status").value("queued"))
                .andExpect(jsonPath("$.data.result.job_id").value("job-1"));

        verify(audioJobService, never()).sendExtractionTask(anyString(), anyString());
    }

    @Test
    @DisplayName("Should wait for the worker when wait=true")
    void addSong_shouldWaitForWorker() throws Exception {
        JobResult reply = JobResult.fromReply(objectMapper.readTree(
                "{\"job_id\":\"job-1\",\"status\":\"extracted\",\"music_name\":\"00001.wav\",\"id\":1}"));
        when(audioJobService.uploadReferenceSong(any())).thenReturn(BUCKET_URL);
        when(audioJobService.sendExtractionTask("00001.wav", BUCKET_URL)).thenReturn(reply);

        mockMvc.perform(multipart("/add-song").file(song).param("wait", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("success"))
                .andExpect(jsonPath("$.data.result.status").value("extracted"))
                .andExpect(jsonPath("$.data.result.id").value(1));
    }

    @Test
    @DisplayName("Should map a failed job to 502")
    void addSong_shouldMapFailedJobToBadGateway() throws Exception {
        when(audioJobService.uploadReferenceSong(any())).thenReturn(BUCKET_URL);
        when(audioJobService.sendExtractionTask("00001.wav", BUCKET_URL))
                .thenThrow(new JobFailedException("job-1", "Could not extract ID from filename"));

        mockMvc.perform(multipart("/add-song").file(song).param("wait", "true"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Could not extract ID from filename"));
    }

    @Test
    @DisplayName("Should answer 400 when the upload is rejected")
    void addSong_shouldRejectInvalidUpload() throws Exception {
        when(audioJobService.uploadReferenceSong(any())).thenThrow(new IllegalArgumentException("File is empty"));

        mockMvc.perform(multipart("/add-song").file(song))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("File is empty"));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // /get-similar
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should return the ranked songs")
    void getSimilar_shouldReturnRanking() throws Exception {
        JobResult reply = JobResult.fromReply(objectMapper.readTree("{\"job_id\":\"job-2\",\"status\":\"completed\","
                + "\"similar\":[{\"id\":1,\"name\":\"00001.wav\",\"similarity\":0.98},{\"id\":2,\"name\":\"00002.wav\",\"similarity\":0.5}]}"));
        when(audioJobService.uploadQuerySong(any())).thenReturn(QUERY_URL);
        when(audioJobService.sendSimilarityTask("query.wav", QUERY_URL, 2)).thenReturn(reply);

        mockMvc.perform(multipart("/get-similar").file(query).param("top_k", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.query_song").value("query.wav"))
                .andExpect(jsonPath("$.data.top_k").value(2))
                .andExpect(jsonPath("$.data.similar_songs.length()").value(2))
                .andExpect(jsonPath("$.data.similar_songs[0].name").value("00001.wav"));
    }

    @Test
    @DisplayName("Should map an RPC timeout to 504")
    void getSimilar_shouldMapTimeoutToGatewayTimeout() throws Exception {
        when(audioJobService.uploadQuerySong(any())).thenReturn(QUERY_URL);
        when(audioJobService.sendSimilarityTask("query.wav", QUERY_URL, 5))
                .thenThrow(new RpcTimeoutException(RabbitMQConfig.AUDIO_SIMILARITY_QUEUE, Duration.ofSeconds(60)));

        mockMvc.perform(multipart("/get-similar").file(query))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.status").value(504));
    }

    @Test
    @DisplayName("Should reject top_k below 1")
    void getSimilar_shouldRejectZeroTopK() throws Exception {
        mockMvc.perform(multipart("/get-similar").file(query).param("top_k", "0"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(audioJobService);
    }

    @Test
    @DisplayName("Should answer 400 when the file part is missing")
    void getSimilar_shouldRequireFile() throws Exception {
        mockMvc.perform(multipart("/get-similar"))
                .andExpect(status().isBadRequest());
    }
}

package com.signalengine.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.signalengine.api.controller.JobController;
import com.signalengine.config.ApiResponseAdvice;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import com.signalengine.exception.GlobalExceptionHandler;
import com.signalengine.job.DispatchResult;
import com.signalengine.job.InMemoryJobQueue;
import com.signalengine.job.Job;
import com.signalengine.job.JobDispatcher;
import com.signalengine.job.JobHandle;
import com.signalengine.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for JobController: dispatch status codes, request validation and
 * job lookup against a real in-memory queue.
 */
@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    private MockMvc mockMvc;

    @Mock
    private JobDispatcher jobDispatcher;

    private InMemoryJobQueue jobQueue;

    @BeforeEach
    void setUp() {
        SignalEngineProperties properties = new SignalEngineProperties();
        properties.getQueues().put("vn", 2);
        MutableClock clock = new MutableClock(Instant.parse("2026-03-02T03:00:00Z"));
        jobQueue = new InMemoryJobQueue(properties, clock);

        JobController controller = new JobController(jobDispatcher, jobQueue);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(clock), new GlobalExceptionHandler(clock))
                .build();
    }

    @Nested
    @DisplayName("POST /api/jobs")
    class Dispatch {

        private static final String BODY = """
                {
                  "queueName": "vn",
                  "instruments": ["HOSE:VIC", "HOSE:FPT"],
                  "mode": "REALTIME",
                  "dedupeKey": "rt:vn-batch"
                }
                """;

        @Test
        @DisplayName("returns 202 with the job handle when admitted")
        void admitted() throws Exception {
            when(jobDispatcher.dispatch(any()))
                    .thenReturn(DispatchResult.admitted(new JobHandle("job-1", "vn"), "rt:vn-batch"));

            mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.admitted").value(true))
                    .andExpect(jsonPath("$.data.jobId").value("job-1"))
                    .andExpect(jsonPath("$.data.queueName").value("vn"))
                    .andExpect(jsonPath("$.data.dedupeKey").value("rt:vn-batch"));
        }

        @Test
        @DisplayName("returns 200 with admitted=false on a duplicate")
        void duplicate() throws Exception {
            when(jobDispatcher.dispatch(any())).thenReturn(DispatchResult.duplicate("rt:vn-batch"));

            mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(BODY))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.admitted").value(false))
                    .andExpect(jsonPath("$.data.reason").value("skip: duplicate"));
        }

        @Test
        @DisplayName("returns 400 when required fields are missing")
        void validation() throws Exception {
            mockMvc.perform(post("/api/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"queueName\": \"vn\", \"instruments\": []}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

            verify(jobDispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("returns 400 naming the accepted values for an unknown priority class")
        void unknownPriorityClass() throws Exception {
            String body = BODY.replace("\"mode\"", "\"priorityClass\": \"URGENT\",\n  \"mode\"");

            mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.field").value("priorityClass"))
                    .andExpect(jsonPath("$.error.details.value").value("URGENT"))
                    .andExpect(jsonPath("$.error.details.accepted.length()").value(3));

            verify(jobDispatcher, never()).dispatch(any());
        }
    }

    @Nested
    @DisplayName("GET /api/jobs/{queue}/{jobId}")
    class GetJob {

        @Test
        @DisplayName("returns the status of a queued job")
        void queuedJob() throws Exception {
            Job job = Job.builder()
                    .id("job-7")
                    .queueName("vn")
                    .instruments(List.of(new Instrument("VIC", "HOSE", true, "trinity")))
                    .mode(PipelineMode.REALTIME)
                    .dedupeKey("rt:HOSE:VIC:vn")
                    .timeout(Duration.ofMinutes(5))
                    .priorityClass(PriorityClass.REALTIME)
                    .build();
            jobQueue.enqueue(job);

            mockMvc.perform(get("/api/jobs/vn/job-7"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.jobId").value("job-7"))
                    .andExpect(jsonPath("$.data.status").value("QUEUED"))
                    .andExpect(jsonPath("$.data.mode").value("REALTIME"))
                    .andExpect(jsonPath("$.data.instruments[0]").value("HOSE:VIC"));
        }

        @Test
        @DisplayName("returns 404 for an unknown job")
        void unknownJob() throws Exception {
            mockMvc.perform(get("/api/jobs/vn/missing"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.error.status").value(404))
                    .andExpect(jsonPath("$.error.retryable").value(false))
                    .andExpect(jsonPath("$.error.details.resourceType").value("Job"))
                    .andExpect(jsonPath("$.error.details.identifier").value("vn/missing"))
                    .andExpect(jsonPath("$.error.path").value("/api/jobs/vn/missing"));
        }
    }
}

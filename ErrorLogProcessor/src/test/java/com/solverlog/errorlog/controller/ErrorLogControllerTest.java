package com.solverlog.errorlog.controller;

import com.solverlog.errorlog.config.DatabaseSettings;
import com.solverlog.errorlog.exception.ErrorKind;
import com.solverlog.errorlog.exception.ErrorLogException;
import com.solverlog.errorlog.exception.LogFormatException;
import com.solverlog.errorlog.exception.ParseStage;
import com.solverlog.errorlog.model.JobSummary;
import com.solverlog.errorlog.service.DatabaseConfigService;
import com.solverlog.errorlog.service.ErrorLogOperations;
import com.solverlog.errorlog.service.JobService;
import com.solverlog.errorlog.service.PayloadChannel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {JobController.class, ErrorLogController.class, DatabaseConfigController.class})
class ErrorLogControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ErrorLogOperations operations;

    @MockBean
    JobService jobService;

    @MockBean
    DatabaseConfigService configService;

    // ---------- /api/jobs/import ----------

    @Test
    void import_returnsJobId() throws Exception {
        when(operations.importLog(Paths.get("/data/run.log"))).thenReturn(666666L);

        mvc.perform(post("/api/jobs/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"/data/run.log\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobId", equalTo(666666)));
    }

    @Test
    void import_400_whenPathBlank() throws Exception {
        mvc.perform(post("/api/jobs/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("path")));
    }

    @Test
    void import_400_onFormatError() throws Exception {
        when(operations.importLog(any()))
            .thenThrow(new LogFormatException(ParseStage.TEMPLATE, "no metric line found"));

        mvc.perform(post("/api/jobs/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"/data/empty.log\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", equalTo("Log format error (template): no metric line found")));
    }

    @Test
    void import_422_onUnreadableFile() throws Exception {
        when(operations.importLog(any()))
            .thenThrow(new ErrorLogException(ErrorKind.IO, "Cannot read log file /nope"));

        mvc.perform(post("/api/jobs/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"/nope\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message", equalTo("Cannot read log file /nope")));
    }

    @Test
    void import_500_onStorageError() throws Exception {
        when(operations.importLog(any()))
            .thenThrow(new ErrorLogException(ErrorKind.STORAGE, "duplicate key"));

        mvc.perform(post("/api/jobs/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"/data/run.log\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message", equalTo("duplicate key")));
    }

    // ---------- /api/jobs ----------

    @Test
    void listJobs() throws Exception {
        when(jobService.listJobs()).thenReturn(List.of(
            JobSummary.builder().id(1L).name("a").queue("q").numCpu(4).nodes(List.of("n1", "n2")).build()));

        mvc.perform(get("/api/jobs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].name", equalTo("a")))
            .andExpect(jsonPath("$[0].nodes", hasSize(2)));
    }

    @Test
    void findJob_404_whenUnknown() throws Exception {
        when(jobService.findJob(9L)).thenReturn(Optional.empty());

        mvc.perform(get("/api/jobs/9"))
            .andExpect(status().isNotFound());
    }

    @Test
    void removeJob_204_then404() throws Exception {
        when(jobService.removeJob(3L)).thenReturn(true);
        when(jobService.removeJob(4L)).thenReturn(false);

        mvc.perform(delete("/api/jobs/3")).andExpect(status().isNoContent());
        mvc.perform(delete("/api/jobs/4")).andExpect(status().isNotFound());
    }

    // ---------- aggregates ----------

    @Test
    void errorLog_streamsMsgpackBytes() throws Exception {
        byte[] payload = {(byte) 0x92, (byte) 0x90, (byte) 0x90};
        doAnswer(inv -> {
            inv.<PayloadChannel>getArgument(1).send(payload);
            return null;
        }).when(operations).queryAggregate(eq(7L), any());

        mvc.perform(get("/api/jobs/7/error-log"))
            .andExpect(status().isOk())
            .andExpect(content().contentType("application/x-msgpack"))
            .andExpect(content().bytes(payload));
    }

    @Test
    void totalTime_okAnd404() throws Exception {
        when(operations.totalTime(1L)).thenReturn(Optional.of(60.0));
        when(operations.totalTime(2L)).thenReturn(Optional.empty());

        mvc.perform(get("/api/jobs/1/total-time"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobId", equalTo(1)))
            .andExpect(jsonPath("$.seconds", equalTo(60.0)));
        mvc.perform(get("/api/jobs/2/total-time"))
            .andExpect(status().isNotFound());
    }

    @Test
    void clearCache_204() throws Exception {
        mvc.perform(delete("/api/error-log/cache"))
            .andExpect(status().isNoContent());

        verify(operations).clearCache();
    }

    // ---------- /api/config/database ----------

    @Test
    void databaseConfig_masksPassword() throws Exception {
        when(configService.currentSettings())
            .thenReturn(DatabaseSettings.builder().host("db1").password("secret").build());

        mvc.perform(get("/api/config/database"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.host", equalTo("db1")))
            .andExpect(jsonPath("$.password", equalTo("********")));
    }

    @Test
    void databaseConfig_put_reconfigures() throws Exception {
        when(configService.reconfigure(any()))
            .thenAnswer(inv -> inv.getArgument(0));

        mvc.perform(put("/api/config/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"host\":\"db2\",\"port\":6543,\"user\":\"u\",\"password\":\"p\",\"database\":\"runs\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.host", equalTo("db2")))
            .andExpect(jsonPath("$.port", equalTo(6543)))
            .andExpect(jsonPath("$.password", equalTo("********")));
    }

    @Test
    void databaseConfig_put_400_onInvalidPort() throws Exception {
        mvc.perform(put("/api/config/database")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"host\":\"db2\",\"port\":0,\"user\":\"u\",\"database\":\"runs\"}"))
            .andExpect(status().isBadRequest());
    }
}

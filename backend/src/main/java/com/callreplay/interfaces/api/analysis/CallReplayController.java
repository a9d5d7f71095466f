package com.callreplay.interfaces.api.analysis;

import com.callreplay.application.analysis.CallAnalysisAppService;
import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.AnalysisResult;
import com.callreplay.domain.analysis.model.IngestAck;
import com.callreplay.domain.analysis.model.PipelineResult;
import com.callreplay.domain.analysis.model.StoreStats;
import com.callreplay.interfaces.api.dto.BatchAnalysisRequest;
import com.callreplay.interfaces.api.dto.BatchAnalysisResponse;
import com.callreplay.interfaces.api.dto.IngestRequest;
import com.callreplay.interfaces.api.dto.OperationResponse;
import com.callreplay.interfaces.api.dto.PrefilterCheckResponse;
import com.callreplay.interfaces.api.dto.SystemInfoResponse;
import com.callreplay.interfaces.api.dto.TranscriptRequest;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/calls")
@RequiredArgsConstructor
public class CallReplayController {

    private final CallAnalysisAppService callAnalysisAppService;

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody TranscriptRequest request) {
        return ResponseEntity.ok(callAnalysisAppService.analyze(request.toTranscript()));
    }

    @PostMapping("/analyze-batch")
    public ResponseEntity<BatchAnalysisResponse> analyzeBatch(@Valid @RequestBody BatchAnalysisRequest request) {
        return ResponseEntity.ok(callAnalysisAppService.analyzeBatch(request.toTranscripts()));
    }

    @PostMapping("/prefilter-check")
    public ResponseEntity<PrefilterCheckResponse> prefilterCheck(@Valid @RequestBody TranscriptRequest request) {
        return ResponseEntity.ok(PrefilterCheckResponse.of(
                request.callId(), callAnalysisAppService.prefilter(request.toTranscript())));
    }

    @PostMapping("/fixes")
    public ResponseEntity<JsonNode> generateFixes(@RequestBody AnalysisResult analysis) {
        return ResponseEntity.ok(callAnalysisAppService.generateFixes(analysis));
    }

    @PostMapping("/summary")
    public ResponseEntity<JsonNode> generateSummary(@RequestBody List<AnalysisResult> analyses) {
        return ResponseEntity.ok(callAnalysisAppService.generateSummary(analyses));
    }

    @PostMapping("/pipeline")
    public CompletableFuture<ResponseEntity<PipelineResult>> runPipeline(@Valid @RequestBody BatchAnalysisRequest request) {
        return callAnalysisAppService.runPipeline(request.toTranscripts())
                .thenApply(result -> result.isFailed()
                        ? ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result)
                        : ResponseEntity.ok(result));
    }

    @PostMapping("/ingest")
    public ResponseEntity<IngestAck> ingest(@Valid @RequestBody IngestRequest request) {
        IngestAck ack = callAnalysisAppService.ingest(request.transcript().toTranscript(), request.metadata());
        if (ack.error() != null) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ack);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
    }

    @GetMapping("/history")
    public ResponseEntity<List<AnalysisResponse>> history(
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(name = "call_id", required = false) String callId,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(callAnalysisAppService.history(startDate, endDate, callId, status, limit));
    }

    @GetMapping("/history/stats")
    public ResponseEntity<StoreStats> historyStats() {
        return ResponseEntity.ok(callAnalysisAppService.historyStats());
    }

    @DeleteMapping("/history")
    public ResponseEntity<OperationResponse> clearHistory() {
        boolean cleared = callAnalysisAppService.clearHistory();
        return cleared
                ? ResponseEntity.ok(new OperationResponse(true, "Analysis history cleared"))
                : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(new OperationResponse(false, "Failed to clear analysis history"));
    }

    @PostMapping("/history/backup")
    public ResponseEntity<OperationResponse> backupHistory(@RequestParam(name = "path", required = false) String path) {
        boolean backedUp = callAnalysisAppService.backupHistory(path);
        return backedUp
                ? ResponseEntity.ok(new OperationResponse(true, "Backup created"))
                : ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(new OperationResponse(false, "No analysis data to back up or backup failed"));
    }

    @GetMapping("/system")
    public ResponseEntity<SystemInfoResponse> systemInfo() {
        return ResponseEntity.ok(callAnalysisAppService.systemInfo());
    }
}

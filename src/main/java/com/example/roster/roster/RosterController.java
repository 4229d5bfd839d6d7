package com.example.roster.roster;

import com.example.roster.common.ApiResponse;
import com.example.roster.iteration.RunOptions;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/rosters")
public class RosterController {

    private static final Logger logger = LoggerFactory.getLogger(RosterController.class);

    private final RosterService rosterService;

    public RosterController(RosterService rosterService) {
        this.rosterService = rosterService;
    }

    // mode=pipeline は早期終了なしで上限まで回す
    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<RosterResponse>> generate(
            @Valid @RequestBody RosterRequest request,
            @RequestParam(name = "mode", required = false, defaultValue = "interactive") String mode) {
        RunOptions options = "pipeline".equalsIgnoreCase(mode)
                ? rosterService.pipelineOptions(request.maxIterations())
                : rosterService.interactiveOptions(request.maxIterations());
        logger.info("POST /api/rosters/generate start={} workers={} mode={}",
                request.startDate(), request.workers().size(), mode);
        RosterService.RosterResult result = rosterService.generate(request, options);

        Map<String, Object> meta = new HashMap<>();
        meta.put("iterations", result.outcome().iterations());
        meta.put("terminationReason", result.outcome().terminationReason());
        meta.put("violationCount", result.outcome().violations().size());
        meta.put("status", result.outcome().report().status());
        return ResponseEntity.ok(ApiResponse.success("ロスターを作成しました", RosterResponse.from(result), meta));
    }

    @GetMapping("/latest")
    public ResponseEntity<ApiResponse<RosterRunSummary>> latest() {
        return ResponseEntity.ok(ApiResponse.success(rosterService.latest()));
    }

    @GetMapping(value = "/{id}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@PathVariable Long id) {
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "plain", StandardCharsets.UTF_8))
                .body(rosterService.report(id));
    }

    @GetMapping(value = "/{id}/export", produces = "text/csv")
    public ResponseEntity<byte[]> exportCsv(@PathVariable Long id) {
        RosterCsvExporter.CsvFile file = rosterService.export(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file.filename() + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(file.data());
    }
}

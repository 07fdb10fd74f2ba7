package com.dcision.pipeline.web;

import com.dcision.pipeline.domain.PipelineRun;
import com.dcision.pipeline.service.CancellationAck;
import com.dcision.pipeline.service.PipelineService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline/runs")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineService pipelineService;

    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody SubmitRequest request) {
        String runId = pipelineService.submit(request.getText(), request.getHints());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("run_id", runId));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<PipelineRun> status(@PathVariable String runId) {
        return ResponseEntity.ok(pipelineService.getStatus(runId));
    }

    @DeleteMapping("/{runId}")
    public ResponseEntity<CancellationAck> cancel(@PathVariable String runId) {
        return ResponseEntity.ok(pipelineService.cancel(runId));
    }
}

package com.tribune.aggregator.controller;

import com.tribune.aggregator.service.RetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/admin/retention")
@RequiredArgsConstructor
public class RetentionController {

    private final RetentionService retentionService;

    @PostMapping("/run")
    public ResponseEntity<RetentionService.RetentionResult> run(
            @RequestParam(name = "days", required = false) Integer days
    ) {
        log.info("Manual retention sweep days={}", days);
        RetentionService.RetentionResult result = days != null ? retentionService.sweep(days) : retentionService.sweep();
        return ResponseEntity.ok(result);
    }
}

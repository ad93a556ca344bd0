package com.flagship.spv_ledger.api;

import com.flagship.spv_ledger.api.dto.RebuildStatusResponse;
import com.flagship.spv_ledger.spv.SpvRebuildService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/spv")
@RequiredArgsConstructor
public class RebuildController {

    private final SpvRebuildService rebuildService;

    /**
     * Outcome of the latest rebuild pass; 404 until a pass has started.
     */
    @GetMapping("/status")
    public ResponseEntity<RebuildStatusResponse> getStatus() {
        return rebuildService.getLastResult()
            .map(result -> ResponseEntity.ok(RebuildStatusResponse.from(result)))
            .orElse(ResponseEntity.notFound().build());
    }
}

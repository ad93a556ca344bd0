package com.flagship.spv_ledger.api;

import com.flagship.spv_ledger.api.dto.WalletResponse;
import com.flagship.spv_ledger.ledger.WalletManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/delegates")
@RequiredArgsConstructor
public class DelegateController {

    private final WalletManager walletManager;

    /**
     * Active delegates in rank order, as of the last completed vote restore.
     */
    @GetMapping
    public List<WalletResponse> getActiveDelegates() {
        return walletManager.getActiveDelegates().stream()
            .map(WalletResponse::from)
            .toList();
    }

    @GetMapping("/{username}")
    public ResponseEntity<WalletResponse> getDelegate(@PathVariable("username") String username) {
        return walletManager.findWalletByUsername(username)
            .map(wallet -> ResponseEntity.ok(WalletResponse.from(wallet)))
            .orElse(ResponseEntity.notFound().build());
    }
}

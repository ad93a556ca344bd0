package com.flagship.spv_ledger.api;

import com.flagship.spv_ledger.api.dto.WalletResponse;
import com.flagship.spv_ledger.ledger.WalletManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to rebuilt wallets. Lookups never create wallets.
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final WalletManager walletManager;

    @GetMapping("/{address}")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable("address") String address) {
        return walletManager.findWalletByAddress(address)
            .map(wallet -> ResponseEntity.ok(WalletResponse.from(wallet)))
            .orElse(ResponseEntity.notFound().build());
    }
}

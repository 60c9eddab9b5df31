package com.flagship.coin_ledger.config;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Public, read-only view of the coin settings so clients can show prices before acting.
 */
@RestController
@RequiredArgsConstructor
public class SettingsController {

    private final CoinSettings settings;

    @GetMapping("/api/settings")
    public ResponseEntity<Map<String, Object>> settings() {
        return ResponseEntity.ok(Map.of(
            "cost_post", settings.getCostPost(),
            "cost_connect", settings.getCostConnect(),
            "allow_refunds", settings.isAllowRefunds(),
            "require_target_accept", settings.isRequireTargetAccept(),
            "coin_price_mvr", settings.getCoinPriceMvr()));
    }
}

package com.flagship.coin_ledger.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Deployment-time coin configuration.
 *
 * Recognized options (prefix {@code coins.}):
 * - cost-post: coins debited when a post is submitted
 * - cost-connect: coins debited when a connection request is sent
 * - allow-refunds: whether rejected/cancelled coin-bearing subjects are refunded
 * - require-target-accept: whether an approved connection request waits for the target's answer
 * - coin-price-mvr: price of one coin, captured on each top-up request
 *
 * These are read once at startup. Nothing in a request can override them.
 */
@Component
@Getter
public class CoinSettings {

    private final long costPost;
    private final long costConnect;
    private final boolean allowRefunds;
    private final boolean requireTargetAccept;
    private final BigDecimal coinPriceMvr;

    public CoinSettings(@Value("${coins.cost-post:2}") long costPost,
                        @Value("${coins.cost-connect:5}") long costConnect,
                        @Value("${coins.allow-refunds:true}") boolean allowRefunds,
                        @Value("${coins.require-target-accept:true}") boolean requireTargetAccept,
                        @Value("${coins.coin-price-mvr:10.00}") BigDecimal coinPriceMvr) {
        if (costPost < 0 || costConnect < 0) {
            throw new IllegalArgumentException("Coin costs must not be negative");
        }
        if (coinPriceMvr == null || coinPriceMvr.signum() <= 0) {
            throw new IllegalArgumentException("Coin price must be positive");
        }
        this.costPost = costPost;
        this.costConnect = costConnect;
        this.allowRefunds = allowRefunds;
        this.requireTargetAccept = requireTargetAccept;
        this.coinPriceMvr = coinPriceMvr;
    }
}

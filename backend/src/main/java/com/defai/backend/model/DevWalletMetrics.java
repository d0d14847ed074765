package com.defai.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Balances of wallets attributed to the token's developers. The deployer balance is optional.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DevWalletMetrics(
        @NotNull @Size(max = 1000) List<@NotNull @PositiveOrZero Double> balances,
        @PositiveOrZero Double deployerBalance
) {
    public DevWalletMetrics {
        balances = balances == null ? List.of() : List.copyOf(balances);
    }
}

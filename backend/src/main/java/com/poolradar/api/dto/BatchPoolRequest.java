package com.poolradar.api.dto;

import com.poolradar.api.validation.EvmAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * POST /api/v1/pools/batch request body. Each item is either an address lookup or a token pair with fee
 * (hundredths of a basis point, e.g. 3000).
 */
public record BatchPoolRequest(
        @NotEmpty(message = "INVALID_REQUEST")
        @Size(max = BatchPoolRequest.MAX_ITEMS, message = "BATCH_TOO_LARGE")
        List<@NotNull(message = "INVALID_REQUEST") @Valid Item> requests
) {

    public static final int MAX_ITEMS = 100;

    public record Item(
            @EvmAddress String address,
            @EvmAddress String tokenA,
            @EvmAddress String tokenB,
            Integer fee,
            @NotNull(message = "INVALID_CHAIN") Integer chainId
    ) {
    }
}

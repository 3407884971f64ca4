package com.poolradar.api.validation;

import com.poolradar.domain.SupportedChain;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates pool/token addresses and chain ids for the pools API.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(address.trim()).matches();
    }

    public boolean isSupportedChain(int chainId) {
        return SupportedChain.isSupported(chainId);
    }
}

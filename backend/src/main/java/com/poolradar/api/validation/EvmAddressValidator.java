package com.poolradar.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Jakarta Bean Validation adapter over AddressValidator.
 */
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private final AddressValidator addressValidator;

    public EvmAddressValidator() {
        this(new AddressValidator());
    }

    public EvmAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || addressValidator.isValidAddress(value);
    }
}

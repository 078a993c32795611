/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public class CredentialDetailsValidator implements ConstraintValidator<ValidCredentialDetails, Map<String, Object>> {

    @Override
    public boolean isValid(Map<String, Object> details, ConstraintValidatorContext context) {
        // null is left to @NotNull
        if (details == null) {
            return true;
        }
        if (details.isEmpty()) {
            return violation(context, "Details must contain at least one entry");
        }
        for (var entry : details.entrySet()) {
            if (StringUtils.isBlank(entry.getKey())) {
                return violation(context, "Detail keys cannot be blank");
            }
            var value = entry.getValue();
            if (value == null || (value instanceof String text && text.isBlank())) {
                return violation(context, "Detail values cannot be null or blank");
            }
        }
        return true;
    }

    private static boolean violation(ConstraintValidatorContext context, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message).addConstraintViolation();
        return false;
    }
}

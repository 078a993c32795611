/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Credential details must hold at least one entry, every key must be non-blank and no value may be
 * null or a blank string.
 */
@Documented
@Constraint(validatedBy = CredentialDetailsValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidCredentialDetails {
    String message() default "Details must contain at least one entry with non-blank keys and non-empty values";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}

/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;

public record CredentialIssuedEvent(CredentialDto credential) {
}

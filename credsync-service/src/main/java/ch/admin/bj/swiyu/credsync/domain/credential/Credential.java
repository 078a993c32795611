/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.domain.credential;

import ch.admin.bj.swiyu.credsync.common.date.TimeUtils;
import ch.admin.bj.swiyu.credsync.common.hash.CanonicalHasher;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tamper-evident credential.
 * <p>
 * The {@code id} is derived from the credential content, so issuing the same content twice yields the
 * same id. The {@code hash} covers every other field and is recomputed whenever a record crosses a
 * service boundary.
 */
@Entity
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Table(name = "credential")
public class Credential implements Persistable<String> {

    @Id
    private String id;

    @NotNull
    private String name;

    @NotNull
    private String credentialType;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> details;

    /**
     * Label of the worker process which issued the credential, e.g. worker-2
     */
    @NotNull
    private String issuedBy;

    /**
     * Millisecond precision, used as cursor for the catch-up synchronization
     */
    @NotNull
    private Instant issuedAt;

    @NotNull
    private String hash;

    @Transient
    @Getter(AccessLevel.NONE)
    @Builder.Default
    private boolean newEntity = true;

    /**
     * Creates a freshly issued credential and seals it with its hash.
     */
    public static Credential issue(String name, String credentialType, Map<String, Object> details,
                                   String issuedBy, Instant issuedAt) {
        var credential = Credential.builder()
                .id(deriveId(name, credentialType, details))
                .name(name)
                .credentialType(credentialType)
                .details(details)
                .issuedBy(issuedBy)
                .issuedAt(issuedAt.truncatedTo(ChronoUnit.MILLIS))
                .build();
        credential.hash = credential.computeHash();
        return credential;
    }

    public static String deriveId(String name, String credentialType, Map<String, Object> details) {
        var content = new LinkedHashMap<String, Object>();
        content.put("name", name);
        content.put("credentialType", credentialType);
        content.put("details", details);
        return CanonicalHasher.hash(content);
    }

    public String computeHash() {
        return CanonicalHasher.hash(hashedContent());
    }

    public boolean hasValidHash() {
        return CanonicalHasher.digestsEqual(hash, computeHash());
    }

    public String getIssuedAtIso() {
        return TimeUtils.instantToIsoMillis(issuedAt);
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newEntity = false;
    }

    private Map<String, Object> hashedContent() {
        var content = new LinkedHashMap<String, Object>();
        content.put("id", id);
        content.put("name", name);
        content.put("credentialType", credentialType);
        content.put("details", details);
        content.put("issuedBy", issuedBy);
        content.put("issuedAt", getIssuedAtIso());
        return content;
    }
}

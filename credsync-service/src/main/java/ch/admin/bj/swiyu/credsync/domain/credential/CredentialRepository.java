/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.domain.credential;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface CredentialRepository extends JpaRepository<Credential, String> {

    @Query("SELECT max(c.issuedAt) FROM Credential c")
    Optional<Instant> findLatestIssuedAt();

    List<Credential> findByIssuedAtAfterOrderByIssuedAtAscIdAsc(Instant since);

    List<Credential> findAllByOrderByIssuedAtAscIdAsc();

    /**
     * Inserts the credential or replaces every field of the existing row with the same id.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(nativeQuery = true, value = """
            INSERT INTO credential (id, name, credential_type, details, issued_by, issued_at, hash)
            VALUES (:id, :name, :credentialType, CAST(:details AS jsonb), :issuedBy, :issuedAt, :hash)
            ON CONFLICT (id) DO UPDATE SET
                name = EXCLUDED.name,
                credential_type = EXCLUDED.credential_type,
                details = EXCLUDED.details,
                issued_by = EXCLUDED.issued_by,
                issued_at = EXCLUDED.issued_at,
                hash = EXCLUDED.hash
            """)
    int upsert(@Param("id") String id,
               @Param("name") String name,
               @Param("credentialType") String credentialType,
               @Param("details") String details,
               @Param("issuedBy") String issuedBy,
               @Param("issuedAt") Instant issuedAt,
               @Param("hash") String hash);
}

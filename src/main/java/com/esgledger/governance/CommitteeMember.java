package com.esgledger.governance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A committee member allowed to propose and vote.
 */
@Entity
@Table(name = "committee_members")
@Data
@NoArgsConstructor
public class CommitteeMember {

    @Id
    private String memberId;

    private String addedBy;

    @Column(name = "added_at")
    private Instant addedAt;

    public CommitteeMember(String memberId, String addedBy) {
        this.memberId = memberId;
        this.addedBy = addedBy;
        this.addedAt = Instant.now();
    }
}

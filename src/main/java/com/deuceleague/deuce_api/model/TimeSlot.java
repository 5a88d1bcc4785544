package com.deuceleague.deuce_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Getter
@Entity
@Table(name = "match_time_slots")
public class TimeSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "match_id", nullable = false)
    private Match match;

    @Column(name = "proposed_time", nullable = false)
    private LocalDateTime proposedTime;

    private String location;

    @Column(name = "proposed_by_id", nullable = false)
    private UUID proposedById;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TimeSlotStatus status = TimeSlotStatus.PROPOSED;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "match_time_slot_votes", joinColumns = @JoinColumn(name = "time_slot_id"))
    @Column(name = "user_id", nullable = false)
    private Set<UUID> votes = new LinkedHashSet<>();

    @Setter
    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    public TimeSlot() {}

    TimeSlot(Match match, LocalDateTime proposedTime, String location, UUID proposedById) {
        this.match = match;
        this.proposedTime = proposedTime;
        this.location = location;
        this.proposedById = proposedById;
        this.votes.add(proposedById);
    }

    public boolean hasVoted(UUID userId) {
        return votes.contains(userId);
    }

    public void addVote(UUID userId) {
        votes.add(userId);
    }
}

package com.officehours.queue.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.ZoneId;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "office_queue")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Queue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    /** IANA zone id all weekday windows of this queue are computed in. */
    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone;

    @JsonIgnore
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "office_queue_admin", joinColumns = @JoinColumn(name = "queue_id"))
    @Column(name = "email", nullable = false, length = 320)
    @Builder.Default
    private Set<String> admins = new HashSet<>();

    public ZoneId zone() {
        return ZoneId.of(timeZone);
    }

    public boolean isAdmin(String email) {
        return email != null && admins.contains(email);
    }
}

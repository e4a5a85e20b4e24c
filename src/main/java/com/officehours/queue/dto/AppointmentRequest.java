package com.officehours.queue.dto;

import lombok.*;

/**
 * Student-supplied part of an appointment. Queue, time, duration and student are always
 * stamped by the server.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentRequest {

    private String name;

    private String description;

    private String location;

    /** Target timeslot on update; ignored on signup, where the path decides. */
    private Integer timeslot;

    private Float mapX;

    private Float mapY;
}

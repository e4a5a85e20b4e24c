package com.officehours.queue.dto;

import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRequest {

    /** Minutes per timeslot. */
    private Integer duration;

    /** One capacity digit per timeslot, e.g. {@code "2110"}. */
    private String schedule;
}

package com.whereq.dispatch.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New schedule of a @cron trigger
 *
 * @author WhereQ Inc.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CronUpdateRequest {
    @NotBlank
    private String arguments;
}

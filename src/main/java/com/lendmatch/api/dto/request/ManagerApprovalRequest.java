package com.lendmatch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lets {@code manager} act on {@code delegator}'s positions, or revokes it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManagerApprovalRequest {

    @NotBlank(message = "Delegator is required")
    private String delegator;

    @NotBlank(message = "Manager is required")
    private String manager;

    private boolean allowed;
}

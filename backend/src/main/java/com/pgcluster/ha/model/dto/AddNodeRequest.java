package com.pgcluster.ha.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddNodeRequest {

    @NotBlank(message = "Node address is required")
    @Pattern(regexp = "^[A-Za-z0-9.:\\-]+$", message = "Node address must be an IP address or hostname")
    private String address;
}

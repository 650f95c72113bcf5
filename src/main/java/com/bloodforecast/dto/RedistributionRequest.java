package com.bloodforecast.dto;

import com.bloodforecast.ml.BloodTypes;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RedistributionRequest {

    @NotNull(message = "fromHospitalId is required")
    Long fromHospitalId;

    @NotNull(message = "toHospitalId is required")
    Long toHospitalId;

    @NotBlank(message = "bloodType is required")
    @Pattern(regexp = BloodTypes.PATTERN, message = "bloodType must be an ABO/Rh group such as O+ or AB-")
    String bloodType;

    @Min(value = 1, message = "units must be >= 1")
    int units;
}

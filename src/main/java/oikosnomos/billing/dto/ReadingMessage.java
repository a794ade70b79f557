package oikosnomos.billing.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound payload of home/{home_id}/device/{category}/power.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReadingMessage {

    // RFC3339
    private String timestamp;

    @JsonProperty("device_category")
    private String deviceCategory;

    @JsonProperty("power_w")
    private Double powerW;

    @JsonProperty("energy_wh")
    private Double energyWh;
}

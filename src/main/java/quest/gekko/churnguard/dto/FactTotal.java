package quest.gekko.churnguard.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FactTotal(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("total") BigDecimal total
) {
    public boolean hasActivity() {
        return total != null && total.signum() > 0;
    }
}

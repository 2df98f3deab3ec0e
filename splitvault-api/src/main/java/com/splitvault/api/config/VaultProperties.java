package com.splitvault.api.config;

import com.splitvault.api.dispute.UnvotedDisputePolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Vault configuration constants.
 */
@Configuration
@ConfigurationProperties(prefix = "splitvault.vault")
@Validated
public class VaultProperties {

    @NotBlank
    private String account = "vault";

    @NotNull
    private Duration disputeDuration = Duration.ofSeconds(604_800); // 7 days

    @Min(1)
    private int initiationAmountDenominator = 4;

    @Min(1)
    private int feeDenominator = 100;

    private String conditionDescription = "";

    @NotNull
    private UnvotedDisputePolicy unvotedDisputePolicy = UnvotedDisputePolicy.REFUND_INITIATOR;

    public String getAccount() { return account; }
    public void setAccount(String account) { this.account = account; }
    public Duration getDisputeDuration() { return disputeDuration; }
    public void setDisputeDuration(Duration disputeDuration) { this.disputeDuration = disputeDuration; }
    public int getInitiationAmountDenominator() { return initiationAmountDenominator; }
    public void setInitiationAmountDenominator(int denominator) { this.initiationAmountDenominator = denominator; }
    public int getFeeDenominator() { return feeDenominator; }
    public void setFeeDenominator(int feeDenominator) { this.feeDenominator = feeDenominator; }
    public String getConditionDescription() { return conditionDescription; }
    public void setConditionDescription(String description) { this.conditionDescription = description; }
    public UnvotedDisputePolicy getUnvotedDisputePolicy() { return unvotedDisputePolicy; }
    public void setUnvotedDisputePolicy(UnvotedDisputePolicy policy) { this.unvotedDisputePolicy = policy; }
}

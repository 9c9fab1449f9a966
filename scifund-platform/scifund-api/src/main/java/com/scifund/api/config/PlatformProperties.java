package com.scifund.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Initial platform parameters. Applied once, when no settings row exists yet.
 */
@Configuration
@ConfigurationProperties(prefix = "scifund.platform")
public class PlatformProperties {

    private String owner;
    private String feeRecipient;
    private int feeBps = 250;
    private List<String> verifiers = new ArrayList<>();

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public String getFeeRecipient() { return feeRecipient; }
    public void setFeeRecipient(String feeRecipient) { this.feeRecipient = feeRecipient; }
    public int getFeeBps() { return feeBps; }
    public void setFeeBps(int feeBps) { this.feeBps = feeBps; }
    public List<String> getVerifiers() { return verifiers; }
    public void setVerifiers(List<String> verifiers) { this.verifiers = verifiers; }
}

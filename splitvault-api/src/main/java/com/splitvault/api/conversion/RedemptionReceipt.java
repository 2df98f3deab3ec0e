package com.splitvault.api.conversion;

import java.math.BigInteger;

/**
 * @param locked lock state the redemption ran under; when true a cToken was burned with each iToken
 */
public record RedemptionReceipt(BigInteger amount, boolean locked) {}

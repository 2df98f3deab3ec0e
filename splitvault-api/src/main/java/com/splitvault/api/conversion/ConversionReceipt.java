package com.splitvault.api.conversion;

import java.math.BigInteger;

public record ConversionReceipt(BigInteger amount, BigInteger fee, BigInteger minted) {}

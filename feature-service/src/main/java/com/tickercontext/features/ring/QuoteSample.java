package com.tickercontext.features.ring;

import java.time.Instant;

public record QuoteSample(Instant timestamp, double price) {}

package com.qurse.backend.chat.dedup;

import java.time.Instant;
import java.util.List;

public record DuplicateSweepReport(
    Instant since, int conversationsScanned, int deletedCount, List<DuplicateDeletion> deleted) {}

package com.fillbot.hft.filler.submit;

import com.fillbot.hft.domain.FillCandidate;
import com.fillbot.hft.filler.FillOutcome;

/**
 * One classified result line. {@code candidate} is null when the log announced more fills than were
 * packed.
 */
public record FillResultLine(int index, FillCandidate candidate, FillOutcome outcome, String line) {
}

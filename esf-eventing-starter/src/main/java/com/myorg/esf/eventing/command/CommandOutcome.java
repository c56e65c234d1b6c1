package com.myorg.esf.eventing.command;

import com.myorg.esf.eventing.DispatchReport;

/**
 * @param headVersion aggregate version after the commit, 0 when nothing was committed
 */
public record CommandOutcome<R>(R value, long headVersion, int committedEvents, DispatchReport dispatch) {
}

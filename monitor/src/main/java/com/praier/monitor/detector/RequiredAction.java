package com.praier.monitor.detector;

import com.praier.monitor.state.ActionKind;

/**
 * An action the change detector decided should be taken on a pull request.
 */
public interface RequiredAction {

    ActionKind kind();

    /** What the action applies to within the pull request; empty when it applies to the whole PR. */
    String target();
}

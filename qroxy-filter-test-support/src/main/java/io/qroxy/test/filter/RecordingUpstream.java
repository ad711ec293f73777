/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.test.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.qroxy.proxy.filter.Upstream;
import io.qroxy.proxy.query.Reply;

/**
 * An {@link Upstream} that records the replies delivered to it.
 */
public class RecordingUpstream implements Upstream {

    private final List<Reply> replies = new ArrayList<>();

    @Override
    public boolean clientReply(Reply reply) {
        replies.add(reply);
        return true;
    }

    public List<Reply> replies() {
        return Collections.unmodifiableList(replies);
    }

    public int count() {
        return replies.size();
    }
}

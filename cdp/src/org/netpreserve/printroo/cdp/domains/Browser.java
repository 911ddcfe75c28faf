package org.netpreserve.printroo.cdp.domains;

import java.util.concurrent.CompletionStage;

public interface Browser {
    CompletionStage<Void> closeAsync();
}

package org.netpreserve.printroo.cdp.domains;

public interface Target {
    CreateTarget createTarget(String url, Integer width, Integer height);

    AttachToTarget attachToTarget(String targetId, boolean flatten);

    record CreateTarget(String targetId) {
    }

    record AttachToTarget(String sessionId) {
    }
}

package org.netpreserve.printroo;

public enum OutputFormat {
    PDF,
    IMAGE
}

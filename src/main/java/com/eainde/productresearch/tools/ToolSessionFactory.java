package com.eainde.productresearch.tools;

@FunctionalInterface
public interface ToolSessionFactory {

    /**
     * @throws ToolException when the tools cannot be connected
     */
    ToolSession open();
}

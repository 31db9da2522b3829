package com.samterminal.integration.constant;

public interface SamTerminalConstants {

    String QUALIFIED_NAME_SEPARATOR = ":";

    // edge source handles
    String TRUE_HANDLE = "true";
    String FALSE_HANDLE = "false";
    String ERROR_HANDLE = "error";

    // variables written by the flow engine
    String LAST_OUTPUT_VARIABLE = "_lastOutput";
    String ERROR_VARIABLE = "_error";
    String CONDITION_RESULT_VARIABLE = "_conditionResult";
    String LOOP_ITEMS_VARIABLE = "_loopItems";

    String ERROR_MESSAGE_KEY = "message";
    String ERROR_NODE_ID_KEY = "nodeId";
    String ERROR_NODE_NAME_KEY = "nodeName";

    static String qualifiedName(String pluginName, String name) {
        return pluginName + QUALIFIED_NAME_SEPARATOR + name;
    }
}

package com.adapterhost.loader;

/**
 * An extension method registered on a target hook.
 */
public record ExtensionConnection(String extensionToken, String targetToken, String hook, String method, int priority) {

    @Override
    public String toString() {
        return extensionToken + "." + method + " -> " + targetToken + "." + hook + " (priority " + priority + ")";
    }
}

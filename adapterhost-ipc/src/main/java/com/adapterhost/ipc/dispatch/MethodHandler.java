package com.adapterhost.ipc.dispatch;

/** One adapter method exposed over the channel. The return value is serialized as the call's result. */
@FunctionalInterface
public interface MethodHandler {

    Object invoke(CallArguments args) throws Exception;
}

package com.solverlog.errorlog.service;

import java.io.IOException;

/**
 * Byte-oriented sink that carries an aggregate payload back to the caller.
 */
@FunctionalInterface
public interface PayloadChannel {

    void send(byte[] payload) throws IOException;
}

package com.storereplenishment.service;

/** Polled between items; a run stops at the next item boundary once it reports true. */
@FunctionalInterface
public interface AbortSignal {

    AbortSignal NEVER = () -> false;

    boolean isAbortRequested();
}

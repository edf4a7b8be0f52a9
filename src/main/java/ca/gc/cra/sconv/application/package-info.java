/**
 * Application layer: conversion profiles, the multi-form string cache, and the ports they need.
 * <p>Nothing here touches {@code java.nio.charset} directly; charset work goes through the ports in
 * {@code ca.gc.cra.sconv.application.port}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.application;

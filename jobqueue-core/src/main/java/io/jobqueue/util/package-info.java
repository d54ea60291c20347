/**
 * Small shared utilities: thread factory, JSON codec, id generation.
 */
package io.jobqueue.util;

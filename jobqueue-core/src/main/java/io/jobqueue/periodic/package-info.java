/**
 * Recurring jobs: schedules (fixed interval or Quartz cron), templates and the
 * in-process {@link io.jobqueue.periodic.PeriodicJobScheduler}.
 */
package io.jobqueue.periodic;

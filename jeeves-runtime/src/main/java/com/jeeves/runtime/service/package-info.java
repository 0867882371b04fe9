/**
 * Request-facing facade over the runtime: envelope creation, bound checks, event-list execution
 * and resume.
 */
package com.jeeves.runtime.service;

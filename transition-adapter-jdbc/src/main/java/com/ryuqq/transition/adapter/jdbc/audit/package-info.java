/**
 * Audit table DDL and history queries.
 */
package com.ryuqq.transition.adapter.jdbc.audit;

/**
 * Map-backed translation catalog.
 */
package com.ryuqq.transition.adapter.inmemory.translation;

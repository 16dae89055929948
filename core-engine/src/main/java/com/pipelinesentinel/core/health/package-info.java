/**
 * Health queries for the query layer: per pipeline, per team and global.
 *
 * @since 1.0.0
 */
package com.pipelinesentinel.core.health;

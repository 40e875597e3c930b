/**
 * Nightly batch job wiring the risk pipeline to the Supabase REST store.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.aerarisk.job.NightlyRiskJob}: main entry point</li>
 * <li>{@link com.aerarisk.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.aerarisk.job.SupabaseClient}: PostgREST calls over
 * OkHttp</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.aerarisk.job;

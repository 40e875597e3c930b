/**
 * Model parameter configuration.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.aerarisk.core.config.ModelConfigLoader} into a
 * {@link com.aerarisk.core.config.ModelConfig}. Validation runs right after
 * parsing and reports every invalid value at once through a
 * {@link com.aerarisk.core.config.ConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.aerarisk.core.config;

/**
 * Battery alert detection.
 *
 * <p>
 * All rules implement {@link com.voltsentinel.core.detection.AlertRule} and are
 * pure functions of a {@link com.voltsentinel.core.detection.DetectionContext}.
 * {@link com.voltsentinel.core.detection.AlertDetector} schedules them:
 * </p>
 * <ul>
 * <li>level tier: {@link com.voltsentinel.core.detection.DisposalRule},
 * {@link com.voltsentinel.core.detection.CriticalLevelRule},
 * {@link com.voltsentinel.core.detection.LowLevelRule}</li>
 * <li>independent: {@link com.voltsentinel.core.detection.HealthDegradationRule},
 * {@link com.voltsentinel.core.detection.SwapDetectionRule},
 * {@link com.voltsentinel.core.detection.SuddenDropRule}</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a rule, implement {@code AlertRule} and register its name in
 * {@code AlertRuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.detection;

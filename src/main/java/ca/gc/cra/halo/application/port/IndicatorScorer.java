package ca.gc.cra.halo.application.port;

import ca.gc.cra.halo.domain.analysis.IndicatorSet;
import ca.gc.cra.halo.domain.analysis.MeasurementBundle;
import ca.gc.cra.halo.domain.error.ScoringException;

/**
 * Turns measurements into named indicators.
 *
 * <p>Indicators a scorer cannot derive are omitted rather than defaulted; the aggregate score only
 * weighs indicators that are present.
 *
 * @since 0.1.0
 */
public interface IndicatorScorer {

  IndicatorSet score(MeasurementBundle measurements) throws ScoringException;
}

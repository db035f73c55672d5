package org.fhirquery.core.context;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.context.PerformanceOptionsEnum;
import ca.uhn.fhir.parser.LenientErrorHandler;
import ca.uhn.fhir.parser.StrictErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default implementation of FhirContextFactory.
 * <p>
 * Creates the R5 context lazily on first access and caches it.
 * </p>
 */
@Component
public class FhirContextFactoryImpl implements FhirContextFactory {

    private static final Logger log = LoggerFactory.getLogger(FhirContextFactoryImpl.class);

    private final boolean strictParsing;
    private volatile FhirContext context;

    public FhirContextFactoryImpl(@Value("${fhirquery.config.parser-error-handler:strict}") String parserErrorHandler) {
        this.strictParsing = !"lenient".equalsIgnoreCase(parserErrorHandler);
    }

    @Override
    public FhirContext getContext() {
        FhirContext result = context;
        if (result == null) {
            synchronized (this) {
                result = context;
                if (result == null) {
                    result = createContext();
                    context = result;
                }
            }
        }
        return result;
    }

    private FhirContext createContext() {
        log.info("Creating FHIR R5 context");
        long startTime = System.currentTimeMillis();

        FhirContext created = FhirContext.forR5();

        if (strictParsing) {
            created.setParserErrorHandler(new StrictErrorHandler());
        } else {
            created.setParserErrorHandler(new LenientErrorHandler());
        }
        created.setPerformanceOptions(PerformanceOptionsEnum.DEFERRED_MODEL_SCANNING);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Created FHIR R5 context in {} ms (strict parsing: {})", duration, strictParsing);

        return created;
    }
}

package org.neuralchilli.rasterindex.config;

import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.neuralchilli.rasterindex.core.FormulaLibrary;
import org.neuralchilli.rasterindex.core.FormulaResolver;
import org.neuralchilli.rasterindex.raster.BandStatisticsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the shared, immutable formula library and its resolver.
 */
@ApplicationScoped
public class RasterIndexBeans {

    private static final Logger log = LoggerFactory.getLogger(RasterIndexBeans.class);

    @Produces
    @Singleton
    @Startup
    public FormulaLibrary formulaLibrary(FormulaLibraryLoader loader, RasterIndexConfig config) {
        FormulaLibrary library = loader.load(config.formulas());
        log.info("Formula library ready: {} indices, longest reference chain {}",
                library.size(), library.maxReferenceDepth());
        return library;
    }

    @Produces
    @Singleton
    public FormulaResolver formulaResolver(FormulaLibrary library, BandStatisticsProvider statistics) {
        return new FormulaResolver(library, statistics);
    }
}

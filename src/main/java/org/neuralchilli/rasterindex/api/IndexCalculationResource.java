package org.neuralchilli.rasterindex.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.neuralchilli.rasterindex.core.FormulaLibrary;
import org.neuralchilli.rasterindex.domain.CalculationReport;
import org.neuralchilli.rasterindex.domain.CalculationRequest;
import org.neuralchilli.rasterindex.domain.IndexFormula;
import org.neuralchilli.rasterindex.service.IndexCalculator;

import java.util.List;

@Path("/indices")
@Produces(MediaType.APPLICATION_JSON)
public class IndexCalculationResource {

    @Inject
    FormulaLibrary library;

    @Inject
    IndexCalculator calculator;

    @GET
    public List<FormulaDescription> list() {
        return library.formulas().stream()
                .map(this::describe)
                .toList();
    }

    @GET
    @Path("/{name}")
    public FormulaDescription get(@PathParam("name") String name) {
        IndexFormula formula = library.find(name)
                .orElseThrow(() -> new NotFoundException("Unknown index: " + name));
        return describe(formula);
    }

    /**
     * Runs the calculation synchronously and returns once every result is final.
     */
    @POST
    @Path("/calculate")
    @Consumes(MediaType.APPLICATION_JSON)
    public CalculationReport calculate(CalculationRequest request) {
        return calculator.execute(request);
    }

    private FormulaDescription describe(IndexFormula formula) {
        return new FormulaDescription(
                formula.name(),
                formula.template(),
                library.dependenciesOf(formula.name())
        );
    }
}

package com.raditha.cyclone.analyzer;

import com.raditha.cyclone.config.CloneDetectionConfig;
import com.raditha.cyclone.model.CloneRegion;
import com.raditha.cyclone.model.CloneType;
import com.raditha.cyclone.model.SourceRepository;
import com.raditha.cyclone.parser.NodeKind;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property tests for rename tolerance of the detector.
 */
class CloneDetectorPropertyTest {

    private static final String TEMPLATE = """
            class Sums {
                int sum(int x) {
                    int ACC = 0;
                    for (int i = 0; i < x; i++) {
                        ACC += i * 2;
                    }
                    return ACC;
                }
            }
            """;

    private final CloneDetectionConfig config = CloneDetectionConfig.moderate()
            .withAnchorKinds(Set.of(NodeKind.METHOD_DECLARATION))
            .withParallelism(1);

    @Provide
    Arbitrary<String> names() {
        return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(6).map(s -> "v_" + s);
    }

    @Property(tries = 40)
    void renamedVariableIsAlwaysAnExactClone(@ForAll("names") String left, @ForAll("names") String right)
            throws InterruptedException {
        SourceRepository a = new SourceRepository("a", Map.of("Sums.java", TEMPLATE.replace("ACC", left)));
        SourceRepository b = new SourceRepository("b", Map.of("Sums.java", TEMPLATE.replace("ACC", right)));

        CloneReport report = new CloneDetector(config).detect(a, b);

        assertEquals(1, report.getRegionCount());
        CloneRegion region = report.regions().get(0);
        assertEquals(1.0, region.confidence());
        assertEquals(left.equals(right) ? CloneType.TYPE1 : CloneType.TYPE2, region.type());
        assertTrue(region.members().get(0).edits().isEmpty());
    }

    @Property(tries = 20)
    void changedConstantIsType2(@ForAll("names") String name) throws InterruptedException {
        String original = TEMPLATE.replace("ACC", name);
        String changed = original.replace("i * 2", "i * 7");

        CloneReport report = new CloneDetector(config).detect(
                new SourceRepository("a", Map.of("Sums.java", original)),
                new SourceRepository("b", Map.of("Sums.java", changed)));

        assertEquals(1, report.getRegionCount());
        assertEquals(CloneType.TYPE2, report.regions().get(0).type());
    }
}

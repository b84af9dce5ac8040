package simgo.sema;

import simgo.ast.Program;
import simgo.ast.TreeScanner;
import simgo.ast.stmt.ForStmt;
import simgo.ast.stmt.GoStmt;
import simgo.ast.stmt.RangeStmt;
import simgo.ast.type.ArrayTypeRef;
import simgo.ast.type.ChanTypeRef;
import simgo.ast.type.InterfaceTypeRef;
import simgo.ast.type.MapTypeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects Go constructs with no bounded SimplicityHL equivalent: loops,
 * goroutines, channels, interfaces, slices and maps. The whole tree is
 * walked and every occurrence is reported, wherever the type appears
 * (signatures, declarations, {@code make} arguments, literals).
 */
public final class Validator {

    public static final String LOOPS = "loops are not supported in Simplicity";
    public static final String GOROUTINES = "goroutines are not supported in Simplicity";
    public static final String CHANNELS = "channels are not supported in Simplicity";
    public static final String INTERFACES = "interfaces are not supported in Simplicity";
    public static final String SLICES = "slices are not supported, use fixed-size arrays";
    public static final String MAPS = "maps are not supported in Simplicity";

    public List<String> check(Program program) {
        Collector collector = new Collector();
        collector.scan(program);
        return collector.issues;
    }

    public void validate(Program program) {
        List<String> issues = check(program);
        if (!issues.isEmpty()) throw new ValidationException(issues);
    }

    // the bodies of rejected constructs are not descended into
    private static final class Collector extends TreeScanner {
        private final List<String> issues = new ArrayList<>();

        @Override
        public Void visitFor(ForStmt s) {
            issues.add(LOOPS);
            return null;
        }

        @Override
        public Void visitRange(RangeStmt s) {
            issues.add(LOOPS);
            return null;
        }

        @Override
        public Void visitGo(GoStmt s) {
            issues.add(GOROUTINES);
            return null;
        }

        @Override
        public Void visitChan(ChanTypeRef t) {
            issues.add(CHANNELS);
            return null;
        }

        @Override
        public Void visitInterface(InterfaceTypeRef t) {
            issues.add(INTERFACES);
            return null;
        }

        @Override
        public Void visitArray(ArrayTypeRef t) {
            if (t.isSlice()) {
                issues.add(SLICES);
                return null;
            }
            return super.visitArray(t);
        }

        @Override
        public Void visitMap(MapTypeRef t) {
            issues.add(MAPS);
            return null;
        }
    }
}

package net.crnkit.crn;

import java.util.ArrayList;
import java.util.List;
import net.crnkit.crn.model.SpeciesCategory;
import net.crnkit.crn.syntax.CrnRecord;
import net.crnkit.crn.syntax.DeclarationRecord;
import net.crnkit.crn.syntax.IrreversibleRecord;
import net.crnkit.crn.syntax.ModuleRecord;
import net.crnkit.crn.syntax.RateClause;
import net.crnkit.crn.syntax.ReactionRecord;
import net.crnkit.crn.syntax.ReversibleRecord;
import net.crnkit.crn.syntax.SpeciesReference;
import net.crnkit.util.parser.Mapper;
import net.crnkit.util.parser.Mappers;
import net.crnkit.util.parser.MappingException;
import net.crnkit.util.parser.ParseTree;
import net.crnkit.util.parser.RecordMapper;
import net.crnkit.util.parser.TextLocation;
import net.crnkit.util.parser.Token;
import net.crnkit.util.parser.UnionMapper;

/**
 * Converts a CRN parse tree into a list of CrnRecord-s.
 * Records appear in input order. In modular mode, the reactions of each
 * line are grouped into a ModuleRecord; declarations are never grouped.
 */
public class CrnRecordMapper implements Mapper<List<CrnRecord>> {

    public static final Mapper<SpeciesReference> SPECIES =
        new RecordMapper<SpeciesReference>() {
            protected SpeciesReference mapInner(Provider p)
                    throws MappingException {
                TextLocation loc = locationOf(p.getParseTree());
                int multiplier = 1;
                if (p.nextIs(CrnGrammar.MULTIPLIER)) {
                    String text = p.mapNext(Mappers.content());
                    try {
                        multiplier = Integer.parseInt(text);
                    } catch (NumberFormatException exc) {
                        throw new MappingException("Multiplier " + text +
                            " at " + loc + " is too large", exc);
                    }
                }
                String name = p.mapNext(Mappers.content());
                return new SpeciesReference(multiplier, name, loc);
            }
        };

    public static final Mapper<List<SpeciesReference>> SPECIES_LIST =
        Mappers.aggregate(SPECIES);

    public static final Mapper<RateClause.Entry> RATE_ENTRY =
        new RecordMapper<RateClause.Entry>() {
            protected RateClause.Entry mapInner(Provider p)
                    throws MappingException {
                String name = p.mapNext(Mappers.content());
                String literal = p.mapNext(Mappers.content());
                return new RateClause.Entry(name, literal);
            }
        };

    public static final Mapper<RateClause> RATE_CLAUSE =
        new Mapper<RateClause>() {
            public RateClause map(ParseTree tree) throws MappingException {
                List<RateClause.Entry> entries =
                    Mappers.aggregate(RATE_ENTRY).map(tree);
                return new RateClause(entries, locationOf(tree));
            }
        };

    public static final Mapper<ReactionRecord> REACTION =
        new RecordMapper<ReactionRecord>() {
            protected ReactionRecord mapInner(Provider p)
                    throws MappingException {
                TextLocation loc = locationOf(p.getParseTree());
                List<SpeciesReference> reactants = p.mapNext(SPECIES_LIST);
                ParseTree arrow = p.next();
                Provider ap = new Provider(arrow);
                // The arrow token itself.
                ap.next();
                List<SpeciesReference> products = ap.mapNext(SPECIES_LIST);
                RateClause rates = null;
                if (ap.nextIs(CrnGrammar.RATE_CLAUSE))
                    rates = ap.mapNext(RATE_CLAUSE);
                if (ap.hasNext())
                    throw new MappingException("Parse tree " +
                        arrow.getName() + " has too many children");
                if (CrnGrammar.IRREVERSIBLE.equals(arrow.getName())) {
                    return new IrreversibleRecord(reactants, products, rates,
                                                  loc);
                } else if (CrnGrammar.REVERSIBLE.equals(arrow.getName())) {
                    return new ReversibleRecord(reactants, products, rates,
                                                loc);
                } else {
                    throw new MappingException("Unknown reaction type " +
                                               arrow.getName());
                }
            }
        };

    public static final Mapper<DeclarationRecord> DECLARATION =
        new RecordMapper<DeclarationRecord>() {
            protected DeclarationRecord mapInner(Provider p)
                    throws MappingException {
                TextLocation loc = locationOf(p.getParseTree());
                String keyword = p.mapNext(Mappers.content());
                SpeciesCategory cat = SpeciesCategory.fromKeyword(keyword);
                if (cat == null)
                    throw new MappingException("Unknown species category " +
                                               keyword);
                List<String> ids = new ArrayList<String>();
                while (p.hasNext()) ids.add(p.mapNext(Mappers.content()));
                return new DeclarationRecord(cat, ids, loc);
            }
        };

    /* The items a line may hold. */
    public static final UnionMapper<CrnRecord> LINE_ITEM =
        new UnionMapper<CrnRecord>()
            .add(CrnGrammar.REACTION, REACTION)
            .add(CrnGrammar.DECLARATION, DECLARATION);

    /* Declarations standing on a line of their own. */
    private static final UnionMapper<CrnRecord> DECLARATION_ONLY =
        new UnionMapper<CrnRecord>()
            .add(CrnGrammar.DECLARATION, DECLARATION);

    private final boolean modular;

    public CrnRecordMapper(boolean modular) {
        this.modular = modular;
    }

    public boolean isModular() {
        return modular;
    }

    public List<CrnRecord> map(ParseTree tree) throws MappingException {
        if (! CrnGrammar.DOCUMENT.equals(tree.getName()))
            throw new MappingException("Cannot map parse tree node type " +
                tree.getName() + ", expected " + CrnGrammar.DOCUMENT);
        List<CrnRecord> ret = new ArrayList<CrnRecord>();
        for (ParseTree ch : tree.getChildren()) {
            if (CrnGrammar.MODULE.equals(ch.getName())) {
                mapLine(ch, ret);
            } else {
                ret.add(DECLARATION_ONLY.map(ch));
            }
        }
        return ret;
    }

    /* A "module" node holds the semicolon-separated items of one line. */
    protected void mapLine(ParseTree line, List<CrnRecord> drain)
            throws MappingException {
        List<ReactionRecord> group = new ArrayList<ReactionRecord>();
        for (ParseTree item : line.getChildren()) {
            CrnRecord rec = LINE_ITEM.map(item);
            if (! (rec instanceof ReactionRecord)) {
                flushGroup(group, drain);
                drain.add(rec);
            } else if (modular) {
                group.add((ReactionRecord) rec);
            } else {
                drain.add(rec);
            }
        }
        flushGroup(group, drain);
    }

    private void flushGroup(List<ReactionRecord> group,
                            List<CrnRecord> drain) {
        if (group.isEmpty()) return;
        drain.add(new ModuleRecord(group, group.get(0).getLocation()));
        group.clear();
    }

    protected static TextLocation locationOf(ParseTree tree) {
        Token tok = Mappers.firstToken(tree);
        return (tok == null) ? null : tok.getLocation();
    }

}

package im.arun.tocclassifier.rules;

import im.arun.tocclassifier.model.SectionType;
import im.arun.tocclassifier.util.TitleUtils;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered keyword rules: each section type with the title patterns that lock it.
 *
 * <p>Order is a tie-break. A title is locked to the first section type, in table order,
 * with a matching pattern. Patterns cover the same institutional vocabulary in English,
 * French, Spanish, Russian, Hindi, Arabic, Portuguese, German and Italian, and are kept
 * conservative (no bare "summary", which would also match "summary of findings").
 *
 * <p>The default table is compiled once and shared; instances are immutable and safe for
 * concurrent reads.
 */
public final class KeywordRuleTable {

    private static final int FLAGS =
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    // Letters, digits and underscore only. Combining vowel signs (Devanagari, Arabic) sit on a
    // boundary, so inflected forms such as "परिणामों" still match "परिणाम".
    private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";
    private static final String WORD_BOUNDARY = "(?:(?<=" + WORD_CHAR + ")(?!" + WORD_CHAR + ")"
        + "|(?<!" + WORD_CHAR + ")(?=" + WORD_CHAR + "))";

    private static final Pattern EXPLICIT_ANNEX = compile(
        "\\bannex(es)?\\b|\\bannexe(s)?\\b|\\banexo(s)?\\b|\\bannexure(s)?\\b"
            + "|\\bappendix\\b|\\bappendices\\b|\\battachment(s)?\\b"
            + "|\\bterms\\s+of\\s+reference\\b|\\btermes\\s+de\\s+r[eé]f[eé]rence\\b"
            + "|\\btermos\\s+de\\s+refer[eê]ncia\\b");

    private final List<KeywordRule> rules;
    private final Map<SectionType, KeywordRule> rulesByType;

    public KeywordRuleTable(Map<SectionType, List<String>> phrasesInOrder) {
        List<KeywordRule> compiled = new ArrayList<>();
        Map<SectionType, KeywordRule> byType = new EnumMap<>(SectionType.class);
        phrasesInOrder.forEach((sectionType, phrases) -> {
            KeywordRule rule = new KeywordRule(sectionType, phrases.stream()
                .map(KeywordRuleTable::compile)
                .collect(Collectors.toUnmodifiableList()));
            compiled.add(rule);
            byType.put(sectionType, rule);
        });
        this.rules = Collections.unmodifiableList(compiled);
        this.rulesByType = Collections.unmodifiableMap(byType);
    }

    /**
     * Compile a rule pattern, with {@code \b} bound to letters and digits rather than the
     * JDK's own word definition.
     */
    static Pattern compile(String regex) {
        return Pattern.compile(regex.replace("\\b", WORD_BOUNDARY), FLAGS);
    }

    public static KeywordRuleTable getInstance() {
        return Holder.INSTANCE;
    }

    public List<KeywordRule> getRules() {
        return rules;
    }

    public List<Pattern> patternsFor(SectionType sectionType) {
        KeywordRule rule = rulesByType.get(sectionType);
        return rule == null ? List.of() : rule.getPatterns();
    }

    /**
     * Whether any pattern of the given section type matches the (normalized) title.
     */
    public boolean matches(SectionType sectionType, String title) {
        KeywordRule rule = rulesByType.get(sectionType);
        return rule != null && rule.matches(TitleUtils.normalizeTitle(title));
    }

    /**
     * First section type, in table order, with a pattern matching the title.
     */
    public Optional<SectionType> firstMatch(String title) {
        if (title == null || title.isEmpty()) {
            return Optional.empty();
        }
        String normalized = TitleUtils.normalizeTitle(title);
        for (KeywordRule rule : rules) {
            if (rule.matches(normalized)) {
                return Optional.of(rule.getSectionType());
            }
        }
        return Optional.empty();
    }

    /**
     * Broad annex / appendix / attachment / terms-of-reference detection on a raw title.
     */
    public boolean isExplicitAnnex(String title) {
        return title != null && EXPLICIT_ANNEX.matcher(title).find();
    }

    @Value
    public static class KeywordRule {
        SectionType sectionType;
        List<Pattern> patterns;

        public boolean matches(String normalizedTitle) {
            if (normalizedTitle == null || normalizedTitle.isEmpty()) {
                return false;
            }
            for (Pattern pattern : patterns) {
                if (pattern.matcher(normalizedTitle).find()) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class Holder {
        private static final KeywordRuleTable INSTANCE = new KeywordRuleTable(defaultPhrases());
    }

    /**
     * The built-in phrase table, in priority order.
     */
    public static Map<SectionType, List<String>> defaultPhrases() {
        Map<SectionType, List<String>> rules = new LinkedHashMap<>();
        rules.put(SectionType.FRONT_MATTER, List.of(
            "\\btable\\s+of\\s+contents\\b",
            "^\\s*contents\\s*$",
            "\\bsommaire\\b",
            "\\btable\\s+des\\s+mati[eè]res\\b",
            "\\b[ií]ndice\\b",
            "\\blista\\s+de\\s+figuras\\b",
            "\\blista\\s+de\\s+tablas\\b",
            "\\blista\\s+de\\s+gr[aá]ficos\\b",
            "\\blista\\s+de\\s+mapas\\b",
            "\\blista\\s+de\\s+cuadros\\b",
            "\\blist\\s+of\\s+figures\\b",
            "\\blist\\s+of\\s+tables\\b",
            "\\bliste\\s+des\\s+figures\\b",
            "\\bliste\\s+des\\s+tableaux\\b",
            "\\backnowledg(e)?ments\\b",
            "\\bremerciements\\b",
            "\\bagradecimientos\\b",
            "\\bforeword\\b",
            "\\bavant[-\\s]?propos\\b",
            "\\bpreface\\b",
            "\\bdisclaimer\\b",
            "\\bdescargo\\s+de\\s+responsabilidad\\b",
            "\\bexenci[oó]n\\s+de\\s+responsabilidad\\b",
            "\\bpersonal\\s+clave\\b",
            "\\bcr[eé]ditos?\\s+fotogr[aá]ficos\\b",
            "\\bcopyright\\b"
        ));
        rules.put(SectionType.ACRONYMS, List.of(
            "\\bacronyms\\b",
            "\\babbreviations\\b",
            "\\bglossary\\b",
            "\\bglossaire\\b",
            "\\bglosario\\b",
            "\\bsigles\\b",
            "\\babr[eé]viations\\b"
        ));
        rules.put(SectionType.EXECUTIVE_SUMMARY, List.of(
            "\\bexecutive\\s+summary\\b",
            "\\bevaluation\\s+brief\\b",
            "^\\s*summary\\s*$",
            "\\br[eé]sum[eé]\\s+ex[eé]cutif\\b",
            "\\bnote\\s+d['’]?évaluation\\b",
            "\\bnote\\s+d['’]?evaluation\\b",
            "\\bresumen\\s+ejecutivo\\b",
            "\\bnota\\s+de\\s+evaluaci[oó]n\\b",
            "\\bисполнительное\\s+резюме\\b",
            "\\bकार्यकारी\\s+सारांश\\b",
            "\\bملخص\\s+تنفيذي\\b",
            "\\bresumo\\s+executivo\\b",
            "\\bnota\\s+de\\s+avalia[çc][aã]o\\b",
            "\\bexekutive\\s+zusammenfassung\\b",
            "\\briassunto\\s+esecutivo\\b"
        ));
        rules.put(SectionType.RECOMMENDATIONS, List.of(
            "\\brecommendations?\\b",
            "\\bmanagement\\s+response\\b",
            "\\bway\\s+forward\\b",
            "\\bnext\\s+steps\\b",
            "\\bconsiderations?\\b",
            "\\baction\\s+plan\\b",
            "\\bpriority\\s+actions?\\b",
            "\\brecommandations?\\b",
            "\\brecomendaciones?\\b",
            "\\bрекомендации\\b",
            "\\bसिफारिशें\\b",
            "\\bالتوصيات\\b",
            "\\brecomenda[çc][oõ]es\\b",
            "\\bempfehlungen\\b",
            "\\braccomandazioni\\b"
        ));
        rules.put(SectionType.CONCLUSIONS, List.of(
            "\\bconclusions?\\b",
            "\\bconclusiones?\\b",
            "\\bвыводы\\b",
            "\\bзаключение\\b",
            "\\bनिष्कर्ष\\b",
            "\\bالاستنتاجات\\b",
            "\\bالخلاصة\\b",
            "\\bconclus[oõ]es\\b",
            "\\bschlussfolgerungen\\b",
            "\\bconclusioni\\b"
        ));
        rules.put(SectionType.METHODOLOGY, List.of(
            "\\bmethodology\\b",
            "\\bmethods?\\b",
            "\\bapproach\\b",
            "\\bdata\\s+collection\\b",
            "\\blimitations?\\b",
            "\\bevaluation\\s+design\\b",
            "\\bresearch\\s+design\\b",
            "\\bm[eé]thodologie\\b",
            "\\bm[eé]thodes\\b",
            "\\bmetodolog[ií]a\\b",
            "\\bm[eé]todos\\b",
            "\\bметодология\\b",
            "\\bметоды\\b",
            "\\bकार्यप्रणाली\\b",
            "\\bविधि\\b",
            "\\bمنهجية\\b",
            "\\bطرق\\b",
            "\\bmetodologia\\b",
            "\\bmethodik\\b",
            "\\bmethoden\\b",
            "\\bmetodi\\b"
        ));
        rules.put(SectionType.INTRODUCTION, List.of(
            "\\bintroduction\\b",
            "\\bpurpose\\b",
            "\\bscope\\b",
            "\\bobject\\s+of\\s+evaluation\\b",
            "\\bobjectives?\\s+of\\s+the\\s+evaluation\\b",
            "\\bevaluation\\s+objectives?\\b",
            "\\bevaluation\\s+aims?\\b",
            "\\bevaluation\\s+questions?\\b",
            "\\bevaluation\\s+features\\b",
            "\\bevaluation\\s+strategy\\b",
            "\\bobjectifs?\\s+de\\s+l[']?évaluation\\b",
            "\\bport[ée]e\\b",
            "\\bobjet\\s+de\\s+l[']?évaluation\\b",
            "\\bintroducci[oó]n\\b",
            "\\bobjetivos?\\s+de\\s+la\\s+evaluaci[oó]n\\b",
            "\\balcance\\b",
            "\\bobjeto\\s+de\\s+la\\s+evaluaci[oó]n\\b",
            "\\bвведение\\b",
            "\\bцели\\s+оценки\\b",
            "\\bзадачи\\b",
            "\\bобъект\\s+оценки\\b",
            "\\bपरिचय\\b",
            "\\bमूल्यांकन\\s+के\\s+उद्देश्य\\b",
            "\\bपरिधि\\b",
            "\\bمقدمة\\b",
            "\\bأهداف\\s+التقييم\\b",
            "\\bنطاق\\b",
            "\\bintrodu[çc][aã]o\\b",
            "\\bobjetivos?\\s+da\\s+avalia[çc][aã]o\\b",
            "\\bescopo\\b",
            "\\beinf[üu]hrung\\b",
            "\\bziele\\s+der\\s+bewertung\\b",
            "\\bumfang\\b",
            "\\bintroduzione\\b",
            "\\bobiettivi\\s+della\\s+valutazione\\b",
            "\\bambito\\b"
        ));
        rules.put(SectionType.CONTEXT, List.of(
            "\\boverview\\b",
            "\\bbackground\\b",
            "\\bcontext\\b",
            "\\bproject\\s+description\\b",
            "\\btheory\\s+of\\s+change\\b",
            "\\bintervention\\b",
            "\\bstrategic\\s+plan\\b",
            "\\bcontexte\\b",
            "\\bvue\\s+d[']ensemble\\b",
            "\\bdescription\\s+du\\s+projet\\b",
            "\\bcontexto\\b",
            "\\bdescripci[oó]n\\s+del\\s+proyecto\\b",
            "\\bобзор\\b",
            "\\bконтекст\\b",
            "\\bописание\\s+проекта\\b",
            "\\bपृष्ठभूमि\\b",
            "\\bप्रसंग\\b",
            "\\bخلفية\\b",
            "\\bسياق\\b",
            "\\bdescri[çc][aã]o\\s+do\\s+projeto\\b",
            "\\bkontext\\b",
            "\\bprojektbeschreibung\\b",
            "\\bcontesto\\b",
            "\\bdescrizione\\s+del\\s+progetto\\b"
        ));
        rules.put(SectionType.APPENDIX, List.of(
            "\\bappendix\\b",
            "\\bappendices\\b",
            "\\bappendice\\b",
            "\\bap[eé]ndice\\b",
            "\\bap[eé]ndices\\b",
            "\\bприложение\\b",
            "\\bприложения\\b",
            "\\bपरिशिष्ट\\b",
            "\\bملحق\\b",
            "\\bملاحق\\b",
            "\\bap[eê]ndice\\b",
            "\\bap[eê]ndices\\b",
            "\\banhang\\b",
            "\\banh[aä]nge\\b",
            "\\bappendici\\b"
        ));
        rules.put(SectionType.FINDINGS, List.of(
            "\\bfindings?\\b",
            "\\bresults?\\b",
            "\\bobservations?\\b",
            "\\banalysis\\b",
            "\\bhallazgos\\b",
            "\\br[eé]sultats?\\b",
            "\\bconstatations?\\b",
            "\\bвыводы\\b",
            "\\bрезультаты\\b",
            "\\bнаблюдения\\b",
            "\\bनिष्कर्ष\\b",
            "\\bपरिणाम\\b",
            "\\bالنتائج\\b",
            "\\bالاستنتاجات\\b",
            "\\bresultados\\b",
            "\\bobserva[çc][oõ]es\\b",
            "\\bergebnisse\\b",
            "\\bbeobachtungen\\b",
            "\\brisultati\\b",
            "\\bosservazioni\\b",
            "\\brelevance\\b",
            "\\beffectiveness\\b",
            "\\befficiency\\b",
            "\\bimpact\\b",
            "\\bsustainability\\b",
            "\\bcoherence\\b",
            "\\bpertinence\\b",
            "\\befficacit[eé]\\b",
            "\\befficience\\b",
            "\\bdurabilit[eé]\\b",
            "\\bcoh[eé]rence\\b"
        ));
        rules.put(SectionType.BIBLIOGRAPHY, List.of(
            "\\bbibliography\\b",
            "\\bworks\\s+cited\\b",
            "\\breferences\\b",
            "\\bbibliographie\\b",
            "\\br[eé]f[eé]rences\\b",
            "\\bbibliograf[ií]a\\b",
            "\\breferencias\\b",
            "\\bбиблиография\\b",
            "\\bссылки\\b",
            "\\bлитература\\b",
            "\\bग्रंथ\\s+सूची\\b",
            "\\bसंदर्भ\\b",
            "\\bالمراجع\\b",
            "\\bقائمة\\s+المراجع\\b",
            "\\bbibliografia\\b",
            "\\brefer[eê]ncias\\b",
            "\\breferenzen\\b",
            "\\breferenze\\b"
        ));
        rules.put(SectionType.ANNEXES, List.of(
            "\\bannex(es)?\\b",
            "\\bannexure(s)?\\b",
            "\\bappendix\\b",
            "\\bappendices\\b",
            "\\battachments?\\b",
            "\\battachment\\b",
            "\\bannexe(s)?\\b",
            "\\bappendice(s)?\\b",
            "\\btermes\\s+de\\s+r[eé]f[eé]rence\\b",
            "\\btdr\\b",
            "\\banexo(s)?\\b",
            "\\bap[eé]ndice(s)?\\b",
            "\\badjuntos?\\b",
            "\\bприложение\\b",
            "\\bприложения\\b",
            "\\bअनुलग्नक\\b",
            "\\bملحق\\b",
            "\\bملاحق\\b",
            "\\bap[eê]ndice(s)?\\b",
            "\\btermos\\s+de\\s+refer[eê]ncia\\b",
            "\\banhang\\b",
            "\\banh[aä]nge\\b",
            "\\ballegato(s)?\\b",
            "附录",
            "附件",
            "\\bterms\\s+of\\s+reference\\b",
            "\\btor\\b",
            "\\banex\\b",
            "\\bapend\\b"
        ));
        return rules;
    }
}

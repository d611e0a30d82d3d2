package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.domain.mapped.*;
import com.vidnyan.j2py.domain.model.*;
import com.vidnyan.j2py.domain.naming.IdentifierKind;
import com.vidnyan.j2py.domain.naming.IdentifierRenamer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates the structural IR into target-language terms: types, identifiers and modifiers.
 *
 * <p>Never fails. Anything without a target counterpart passes through unchanged and is reported
 * as a {@link MapperWarning}. The output has exactly the shape of the input: no declaration is
 * added, dropped or reordered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticMapper {

    private static final Pattern INTEGER_LITERAL =
            Pattern.compile("-?(0[xX][0-9a-fA-F_]+|0[bB][01_]+|[0-9][0-9_]*)[lL]?");
    private static final Pattern FLOAT_LITERAL =
            Pattern.compile("-?([0-9][0-9_]*\\.?[0-9_]*|\\.[0-9][0-9_]*)([eE][+-]?[0-9]+)?[fFdD]?");
    private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"");
    private static final Pattern CHAR_LITERAL = Pattern.compile("'(?:[^'\\\\]|\\\\.)'");

    private static final Map<String, Integer> CONTAINER_ARITY = Map.of(
            "List", 1, "Set", 1, "Optional", 1, "Dict", 2);

    private final MappingTable mappingTable;

    public MappedIr map(StructuralIr ir) {
        List<MapperWarning> warnings = new ArrayList<>();
        Set<String> declared = ir.getClasses().stream().map(ClassDecl::getName).collect(Collectors.toSet());

        MappedIr.MappedIrBuilder mapped = MappedIr.builder();
        mapImports(ir.getImports(), warnings).forEach(mapped::importLine);
        for (ClassDecl cls : ir.getClasses()) {
            mapped.mappedClass(mapClass(cls, declared, warnings));
        }

        MappedIr result = mapped.warnings(warnings).build();
        log.debug("Mapped {} classes with {} warnings", result.getClasses().size(), warnings.size());
        return result;
    }

    private List<String> mapImports(List<String> imports, List<MapperWarning> warnings) {
        Set<String> lines = new LinkedHashSet<>();
        for (String imp : imports) {
            Optional<String> target = mappingTable.lookupImport(imp);
            if (target.isEmpty()) {
                warnings.add(MapperWarning.at("import " + imp, "no Python equivalent, import dropped"));
            } else if (!target.get().isEmpty()) {
                lines.add(target.get());
            }
        }
        return new ArrayList<>(lines);
    }

    private MappedClass mapClass(ClassDecl cls, Set<String> declared, List<MapperWarning> warnings) {
        String location = cls.getName();
        Set<Effect> effects = effectsOf(cls.getModifiers(), location, warnings);

        Set<String> classScope = new HashSet<>(declared);
        classScope.addAll(cls.getTypeParameters());

        String name = IdentifierRenamer.typeName(cls.getName());
        if (!name.equals(cls.getName())) {
            warnings.add(MapperWarning.at(location, "class name is not a valid Python identifier, renamed to '" + name + "'"));
        }
        MappedClass.MappedClassBuilder builder = MappedClass.builder()
                .name(name)
                .kind(cls.getKind())
                .superclass(cls.getSuperclass().map(IdentifierRenamer::typeName).orElse(null))
                .capabilities(typeNames(cls.getInterfaces()))
                .typeParameters(typeNames(cls.getTypeParameters()))
                .line(cls.getLine());

        if (cls.isInterface() || effects.contains(Effect.ABSTRACT)) {
            builder.marker(TargetMarker.ABSTRACT_CLASS);
        }

        for (FieldDecl field : cls.getFields()) {
            builder.field(mapField(field, location, classScope, warnings));
        }
        for (ConstructorDecl ctor : cls.getConstructors()) {
            builder.constructor(mapConstructor(ctor, location, classScope, warnings));
        }
        for (MethodDecl method : cls.getMethods()) {
            builder.method(mapMethod(method, cls, classScope, warnings));
        }
        return builder.build();
    }

    private MappedField mapField(FieldDecl field, String owner, Set<String> scope, List<MapperWarning> warnings) {
        String location = owner + "." + field.getName();
        Set<Effect> effects = effectsOf(field.getModifiers(), location, warnings);
        IdentifierKind kind = IdentifierKind.forField(field.getModifiers());

        MappedField.MappedFieldBuilder builder = MappedField.builder()
                .sourceName(field.getName())
                .name(IdentifierRenamer.rename(field.getName(), kind))
                .kind(kind)
                .type(mapType(field.getType(), scope, location, warnings))
                .sourceType(field.getType())
                .sourceInitializer(field.getInitializer().orElse(null));

        if (effects.contains(Effect.STATIC)) {
            builder.marker(effects.contains(Effect.FINAL) ? TargetMarker.CLASS_CONSTANT : TargetMarker.CLASS_VARIABLE);
        } else {
            builder.marker(TargetMarker.INSTANCE_ATTRIBUTE);
            if (effects.contains(Effect.FINAL)) {
                builder.marker(TargetMarker.READ_ONLY);
            }
        }
        if (effects.contains(Effect.PRIVATE)) {
            builder.marker(TargetMarker.PRIVATE);
        }

        field.getInitializer().ifPresent(raw -> {
            String literal = translateLiteral(raw);
            if (literal == null) {
                warnings.add(MapperWarning.at(location, "initializer '" + raw + "' not translated"));
            }
            builder.initializer(literal);
        });
        return builder.build();
    }

    private MappedConstructor mapConstructor(ConstructorDecl ctor, String owner, Set<String> scope,
                                             List<MapperWarning> warnings) {
        String location = owner + ".<init>";
        Set<Effect> effects = effectsOf(ctor.getModifiers(), location, warnings);
        MappedConstructor.MappedConstructorBuilder builder = MappedConstructor.builder()
                .params(mapParams(ctor.getParams(), scope, location, warnings))
                .body(ctor.getBody());
        if (effects.contains(Effect.PRIVATE)) {
            builder.marker(TargetMarker.PRIVATE);
        }
        return builder.build();
    }

    private MappedMethod mapMethod(MethodDecl method, ClassDecl owner, Set<String> classScope,
                                   List<MapperWarning> warnings) {
        String location = owner.getName() + "." + method.getName() + "()";
        Set<Effect> effects = effectsOf(method.getModifiers(), location, warnings);
        IdentifierKind kind = IdentifierKind.forMethod(method.getModifiers());

        Set<String> scope = classScope;
        if (!method.getTypeParameters().isEmpty()) {
            scope = new HashSet<>(classScope);
            scope.addAll(method.getTypeParameters());
        }

        MappedMethod.MappedMethodBuilder builder = MappedMethod.builder()
                .sourceName(method.getName())
                .name(IdentifierRenamer.rename(method.getName(), kind))
                .kind(kind)
                .params(mapParams(method.getParams(), scope, location, warnings))
                .returnType(mapType(method.getReturnType(), scope, location, warnings))
                .sourceReturnType(method.getReturnType())
                .body(method.getBody())
                .typeParameters(typeNames(method.getTypeParameters()));

        if (effects.contains(Effect.STATIC)) {
            builder.marker(TargetMarker.STATIC_METHOD);
        }
        boolean bodiless = !method.getBody().isPresent();
        if (effects.contains(Effect.ABSTRACT) || (owner.isInterface() && bodiless && !effects.contains(Effect.STATIC))) {
            builder.marker(TargetMarker.ABSTRACT_METHOD);
        }
        if (effects.contains(Effect.PRIVATE)) {
            builder.marker(TargetMarker.PRIVATE);
        }
        return builder.build();
    }

    private List<MappedParam> mapParams(List<ParamDecl> params, Set<String> scope, String location,
                                        List<MapperWarning> warnings) {
        List<MappedParam> mapped = new ArrayList<>(params.size());
        for (ParamDecl param : params) {
            mapped.add(MappedParam.builder()
                    .sourceName(param.getName())
                    .name(IdentifierRenamer.rename(param.getName(), IdentifierKind.PARAM))
                    .type(mapType(param.getType(), scope, location, warnings))
                    .sourceType(param.getType())
                    .build());
        }
        return mapped;
    }

    /**
     * Map a source type to a target annotation. Each array dimension wraps the element in
     * {@code List[...]}; raw containers get {@code Any} arguments.
     */
    TargetType mapType(TypeRef ref, Set<String> scope, String location, List<MapperWarning> warnings) {
        TargetType element = mapElement(ref, scope, location, warnings);
        for (int i = 0; i < ref.getArrayDepth(); i++) {
            element = TargetType.listOf(element);
        }
        return element;
    }

    private TargetType mapElement(TypeRef ref, Set<String> scope, String location, List<MapperWarning> warnings) {
        String name = ref.getName();
        if (name.isBlank() || TypeRef.UNBOUNDED_WILDCARD.equals(name)) {
            return TargetType.any();
        }
        List<TargetType> args = ref.getGenericArgs().stream()
                .map(arg -> mapType(arg, scope, location, warnings))
                .toList();

        String simple = name.substring(name.lastIndexOf('.') + 1);
        Optional<String> target = mappingTable.lookupType(name).or(() -> mappingTable.lookupType(simple));
        if (target.isPresent()) {
            return normalise(target.get(), args);
        }
        if (!scope.contains(name) && !scope.contains(simple)) {
            warnings.add(MapperWarning.at(location, "no mapping for type '" + name + "', kept as is"));
        }
        return TargetType.of(IdentifierRenamer.typeName(name), args);
    }

    private static List<String> typeNames(List<String> names) {
        return names.stream().map(IdentifierRenamer::typeName).toList();
    }

    private static TargetType normalise(String target, List<TargetType> args) {
        Integer arity = CONTAINER_ARITY.get(target);
        if (arity == null) {
            return args.isEmpty() || TargetType.ANY.equals(target) || TargetType.NONE.equals(target)
                    ? TargetType.named(target)
                    : TargetType.of(target, args);
        }
        if (args.size() == arity) {
            return TargetType.of(target, args);
        }
        List<TargetType> padded = new ArrayList<>(args.subList(0, Math.min(args.size(), arity)));
        while (padded.size() < arity) {
            padded.add(TargetType.any());
        }
        return TargetType.of(target, padded);
    }

    /**
     * Translate a simple literal initializer to a Python expression.
     * @return the expression, or null when the initializer is not a simple literal
     */
    static String translateLiteral(String raw) {
        String text = raw.trim();
        switch (text) {
            case "true":
                return "True";
            case "false":
                return "False";
            case "null":
                return "None";
            default:
                break;
        }
        if (INTEGER_LITERAL.matcher(text).matches()) {
            String digits = stripSuffix(text, "lL");
            // Java octal literal, e.g. 017
            String unsigned = digits.startsWith("-") ? digits.substring(1) : digits;
            if (unsigned.length() > 1 && unsigned.startsWith("0") && Character.isDigit(unsigned.charAt(1))) {
                return (digits.startsWith("-") ? "-" : "") + "0o" + unsigned.substring(1);
            }
            return digits;
        }
        if (FLOAT_LITERAL.matcher(text).matches() && text.chars().anyMatch(Character::isDigit)) {
            return stripSuffix(text, "fFdD");
        }
        if (STRING_LITERAL.matcher(text).matches() || CHAR_LITERAL.matcher(text).matches()) {
            return text;
        }
        return null;
    }

    private static String stripSuffix(String text, String suffixes) {
        char last = text.charAt(text.length() - 1);
        return suffixes.indexOf(last) >= 0 ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Reduce a modifier set to the effects the target cares about. Exhaustive over {@link Modifier}.
     */
    private static Set<Effect> effectsOf(Set<Modifier> modifiers, String location, List<MapperWarning> warnings) {
        Set<Effect> effects = EnumSet.noneOf(Effect.class);
        for (Modifier modifier : modifiers) {
            Effect effect = switch (modifier) {
                case PUBLIC, PROTECTED, DEFAULT, STRICTFP, SEALED, NON_SEALED -> Effect.NONE;
                case PRIVATE -> Effect.PRIVATE;
                case STATIC -> Effect.STATIC;
                case FINAL -> Effect.FINAL;
                case ABSTRACT -> Effect.ABSTRACT;
                case SYNCHRONIZED, VOLATILE, TRANSIENT, NATIVE -> Effect.NOT_PRESERVED;
            };
            if (effect == Effect.NOT_PRESERVED) {
                warnings.add(MapperWarning.at(location,
                        "modifier '" + modifier.name().toLowerCase(Locale.ROOT) + "' has no Python equivalent"));
            }
            effects.add(effect);
        }
        return effects;
    }

    private enum Effect {
        NONE,
        PRIVATE,
        STATIC,
        FINAL,
        ABSTRACT,
        NOT_PRESERVED
    }
}

package com.vidnyan.j2py.adapter.out.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import com.github.javaparser.ast.type.WildcardType;
import com.vidnyan.j2py.application.port.out.StructuralParser;
import com.vidnyan.j2py.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses Java source into the structural IR using JavaParser.
 * Names are kept as written; no symbol resolution is attempted.
 */
@Slf4j
@Component
public class JavaParserStructuralParser implements StructuralParser {

    private final JavaParser javaParser;

    public JavaParserStructuralParser() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setStoreTokens(true);
        this.javaParser = new JavaParser(config);
    }

    @Override
    public StructuralIr parse(String sourceText) {
        ParseResult<CompilationUnit> result = javaParser.parse(sourceText);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw toSyntaxException(result.getProblems(), sourceText);
        }

        CompilationUnit cu = result.getResult().get();
        StructuralIr.StructuralIrBuilder ir = StructuralIr.builder()
                .packageName(cu.getPackageDeclaration().map(pd -> pd.getNameAsString()).orElse(""));

        for (ImportDeclaration imp : cu.getImports()) {
            String name = imp.getNameAsString() + (imp.isAsterisk() ? ".*" : "");
            ir.importName(imp.isStatic() ? "static " + name : name);
        }

        Set<String> seen = new HashSet<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            if (!(type instanceof ClassOrInterfaceDeclaration decl)) {
                throw unsupported(type, describe(type) + " declarations are not supported");
            }
            if (!seen.add(decl.getNameAsString())) {
                throw unsupported(decl, "duplicate type declaration " + decl.getNameAsString());
            }
            ir.classDecl(extractClass(decl));
        }

        StructuralIr parsed = ir.build();
        log.debug("Parsed {} classes, {} fields, {} constructors, {} methods",
                parsed.getClasses().size(), parsed.fieldCount(), parsed.constructorCount(), parsed.methodCount());
        return parsed;
    }

    /**
     * Extract a ClassDecl from a ClassOrInterfaceDeclaration.
     */
    private ClassDecl extractClass(ClassOrInterfaceDeclaration decl) {
        boolean isInterface = decl.isInterface();
        ClassDecl.ClassDeclBuilder builder = ClassDecl.builder()
                .name(decl.getNameAsString())
                .kind(isInterface ? ClassKind.INTERFACE : ClassKind.CLASS)
                .modifiers(extractModifiers(decl))
                .line(lineOf(decl));

        decl.getTypeParameters().forEach(tp -> builder.typeParameter(tp.getNameAsString()));

        // Extract super types
        if (isInterface) {
            decl.getExtendedTypes().forEach(et -> builder.interfaceName(et.getNameWithScope()));
        } else if (decl.getExtendedTypes().isNonEmpty()) {
            builder.superclass(decl.getExtendedTypes().get(0).getNameWithScope());
        }
        decl.getImplementedTypes().forEach(it -> builder.interfaceName(it.getNameWithScope()));

        for (BodyDeclaration<?> member : decl.getMembers()) {
            if (member instanceof FieldDeclaration field) {
                for (VariableDeclarator var : field.getVariables()) {
                    builder.field(extractField(var, field, isInterface));
                }
            } else if (member instanceof ConstructorDeclaration ctor) {
                builder.constructor(extractConstructor(ctor));
            } else if (member instanceof MethodDeclaration method) {
                builder.method(extractMethod(method, isInterface));
            } else if (member instanceof InitializerDeclaration init) {
                throw unsupported(init, (init.isStatic() ? "static" : "instance") + " initializer blocks are not supported");
            } else if (member instanceof TypeDeclaration<?> nested) {
                throw unsupported(nested, "nested type " + nested.getNameAsString() + " is not supported");
            } else {
                throw unsupported(member, member.getClass().getSimpleName() + " is not supported");
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SourceSyntaxException(lineOf(decl), columnOf(decl), e.getMessage(), e);
        }
    }

    private FieldDecl extractField(VariableDeclarator var, FieldDeclaration field, boolean inInterface) {
        Set<Modifier> modifiers = extractModifiers(field);
        if (inInterface) {
            // interface fields are implicitly public static final
            modifiers.add(Modifier.PUBLIC);
            modifiers.add(Modifier.STATIC);
            modifiers.add(Modifier.FINAL);
        }
        return FieldDecl.builder()
                .name(var.getNameAsString())
                .type(toTypeRef(var.getType()))
                .modifiers(modifiers)
                .initializer(var.getInitializer().map(this::verbatim).orElse(null))
                .build();
    }

    private ConstructorDecl extractConstructor(ConstructorDeclaration ctor) {
        return ConstructorDecl.builder()
                .params(extractParameters(ctor.getParameters()))
                .modifiers(extractModifiers(ctor))
                .body(MethodBody.opaque(verbatim(ctor.getBody())))
                .build();
    }

    private MethodDecl extractMethod(MethodDeclaration method, boolean inInterface) {
        Set<Modifier> modifiers = extractModifiers(method);
        if (inInterface && method.getBody().isEmpty() && !modifiers.contains(Modifier.STATIC)) {
            modifiers.add(Modifier.ABSTRACT);
        }
        MethodDecl.MethodDeclBuilder builder = MethodDecl.builder()
                .name(method.getNameAsString())
                .params(extractParameters(method.getParameters()))
                .returnType(toTypeRef(method.getType()))
                .modifiers(modifiers)
                .body(method.getBody().map(b -> MethodBody.opaque(verbatim(b))).orElseGet(MethodBody::absent));
        method.getTypeParameters().forEach(tp -> builder.typeParameter(tp.getNameAsString()));
        return builder.build();
    }

    private List<ParamDecl> extractParameters(NodeList<Parameter> parameters) {
        List<ParamDecl> params = new ArrayList<>();
        for (Parameter param : parameters) {
            TypeRef type = toTypeRef(param.getType());
            if (param.isVarArgs()) {
                type = TypeRef.arrayOf(type, 1);
            }
            params.add(ParamDecl.of(param.getNameAsString(), type));
        }
        return params;
    }

    /**
     * Convert a JavaParser type into a TypeRef tree. Generic arguments recurse; array
     * levels are counted instead of kept in the name.
     */
    TypeRef toTypeRef(Type type) {
        int depth = type.getArrayLevel();
        Type element = type.getElementType();

        TypeRef base;
        if (element instanceof PrimitiveType primitive) {
            base = TypeRef.of(primitive.asString());
        } else if (element instanceof VoidType) {
            base = TypeRef.of("void");
        } else if (element instanceof ClassOrInterfaceType classType) {
            TypeRef.TypeRefBuilder builder = TypeRef.builder().name(classType.getNameWithScope());
            classType.getTypeArguments().ifPresent(args -> args.forEach(arg -> builder.genericArg(toTypeRef(arg))));
            base = builder.build();
        } else if (element instanceof WildcardType wildcard) {
            base = wildcard.getExtendedType()
                    .map(bound -> toTypeRef(bound).toBuilder().wildcard(true).build())
                    .or(() -> wildcard.getSuperType()
                            .map(bound -> toTypeRef(bound).toBuilder().wildcard(true).lowerBounded(true).build()))
                    .orElseGet(TypeRef::unboundedWildcard);
        } else {
            throw unsupported(type, "type form '" + type.asString() + "' is not supported");
        }
        return depth == 0 ? base : TypeRef.arrayOf(base, depth);
    }

    private Set<Modifier> extractModifiers(NodeWithModifiers<?> node) {
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        for (com.github.javaparser.ast.Modifier modifier : node.getModifiers()) {
            modifiers.add(switch (modifier.getKeyword()) {
                case PUBLIC -> Modifier.PUBLIC;
                case PRIVATE -> Modifier.PRIVATE;
                case PROTECTED -> Modifier.PROTECTED;
                case STATIC -> Modifier.STATIC;
                case FINAL -> Modifier.FINAL;
                case ABSTRACT -> Modifier.ABSTRACT;
                case SYNCHRONIZED -> Modifier.SYNCHRONIZED;
                case VOLATILE -> Modifier.VOLATILE;
                case TRANSIENT -> Modifier.TRANSIENT;
                case NATIVE -> Modifier.NATIVE;
                case STRICTFP -> Modifier.STRICTFP;
                case DEFAULT -> Modifier.DEFAULT;
                case SEALED -> Modifier.SEALED;
                case NON_SEALED -> Modifier.NON_SEALED;
                default -> throw unsupported(modifier, "modifier '" + modifier.getKeyword().asString() + "' is not supported");
            });
        }
        return modifiers;
    }

    private String verbatim(Node node) {
        return node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
    }

    private SourceSyntaxException toSyntaxException(List<Problem> problems, String sourceText) {
        if (problems.isEmpty()) {
            return new SourceSyntaxException(lastLine(sourceText), 1, "Parse failed");
        }
        Problem first = problems.get(0);
        Position begin = first.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.begin)
                .orElse(new Position(lastLine(sourceText), 1));
        log.debug("Parse failed with {} problems: {}", problems.size(), problems);
        return new SourceSyntaxException(begin.line, begin.column, first.getMessage());
    }

    private SourceSyntaxException unsupported(Node node, String message) {
        return new SourceSyntaxException(lineOf(node), columnOf(node), message);
    }

    private static String describe(TypeDeclaration<?> type) {
        if (type.isEnumDeclaration()) {
            return "enum";
        }
        if (type.isAnnotationDeclaration()) {
            return "annotation type";
        }
        if (type.isRecordDeclaration()) {
            return "record";
        }
        return type.getClass().getSimpleName();
    }

    private static int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(1);
    }

    private static int columnOf(Node node) {
        return node.getBegin().map(p -> p.column).orElse(1);
    }

    private static int lastLine(String sourceText) {
        return Math.max(1, (int) sourceText.lines().count());
    }
}

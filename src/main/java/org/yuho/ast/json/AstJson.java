package org.yuho.ast.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.yuho.ast.Program;
import org.yuho.ast.Span;
import org.yuho.ast.decl.EnumDecl;
import org.yuho.ast.decl.FieldDecl;
import org.yuho.ast.decl.FunctionDecl;
import org.yuho.ast.decl.Item;
import org.yuho.ast.decl.LegalTestDecl;
import org.yuho.ast.decl.Param;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.decl.Requirement;
import org.yuho.ast.decl.ScopeDecl;
import org.yuho.ast.decl.StructDecl;
import org.yuho.ast.decl.TypeAliasDecl;
import org.yuho.ast.decl.VariableDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.expr.Pattern;
import org.yuho.ast.stmt.Stmt;
import org.yuho.ast.type.Constraint;
import org.yuho.ast.type.PrimitiveKind;
import org.yuho.ast.type.TypeRef;
import org.yuho.util.Debug;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes the parser's JSON interchange document into AST records.
 * <p>
 * Every node is an object with a {@code "kind"} discriminator. Types may also be given as a
 * plain string ({@code "int"}, {@code "Theft"}). Spans are optional
 * {@code {"line":..,"column":..,"endLine":..,"endColumn":..}} objects.
 */
public final class AstJson
{
	private AstJson()
	{
	}

	public static Program readProgram(Path file) throws IOException
	{
		String text = Files.readString(file, StandardCharsets.UTF_8);
		String fallbackName = file.getFileName().toString().replaceFirst("[.][^.]+$", "");
		Debug.logDebug("Decoding AST from " + file);
		return parseProgram(text, fallbackName);
	}

	public static Program parseProgram(String json)
	{
		return parseProgram(json, "<program>");
	}

	public static Program parseProgram(String json, String fallbackName)
	{
		JsonObject root = asObject(JsonParser.parseString(json), "program");
		String name = optString(root, "name").orElse(fallbackName);
		return new Program(name, items(array(root, "items", "program")));
	}

	public static Expr parseExpr(String json)
	{
		return expr(JsonParser.parseString(json));
	}

	// --- Items ---

	private static List<Item> items(JsonArray array)
	{
		List<Item> items = new ArrayList<>();
		for (JsonElement element : array)
		{
			items.add(item(element));
		}
		return items;
	}

	private static Item item(JsonElement element)
	{
		JsonObject obj = asObject(element, "item");
		String kind = kind(obj);
		Span span = span(obj);
		switch (kind)
		{
			case "struct":
			{
				List<FieldDecl> fields = new ArrayList<>();
				for (JsonElement f : optArray(obj, "fields"))
				{
					JsonObject field = asObject(f, "field");
					fields.add(new FieldDecl(string(field, "name", "field"), type(member(field, "type", "field")),
							constraints(optArray(field, "constraints")), span(field)));
				}
				return new StructDecl(string(obj, "name", kind), strings(optArray(obj, "typeParams")), fields,
						optString(obj, "parent").orElse(null), span);
			}
			case "enum":
				return new EnumDecl(string(obj, "name", kind), strings(array(obj, "variants", kind)),
						optBoolean(obj, "mutuallyExclusive"), span);
			case "alias":
				return new TypeAliasDecl(string(obj, "name", kind), strings(optArray(obj, "typeParams")),
						type(member(obj, "target", kind)), span);
			case "function":
			{
				List<Param> params = new ArrayList<>();
				for (JsonElement p : optArray(obj, "params"))
				{
					JsonObject param = asObject(p, "param");
					params.add(new Param(string(param, "name", "param"), type(member(param, "type", "param")), span(param)));
				}
				TypeRef returnType = obj.has("returnType") && !obj.get("returnType").isJsonNull() ? type(obj.get("returnType")) : null;
				return new FunctionDecl(string(obj, "name", kind), strings(optArray(obj, "typeParams")), params, returnType,
						stmts(optArray(obj, "body")), span);
			}
			case "declaration":
				return variable(obj);
			case "legalTest":
			{
				List<Requirement> requirements = new ArrayList<>();
				for (JsonElement r : optArray(obj, "requirements"))
				{
					JsonObject req = asObject(r, "requirement");
					requirements.add(new Requirement(string(req, "name", "requirement"), type(member(req, "type", "requirement")), span(req)));
				}
				return new LegalTestDecl(string(obj, "name", kind), requirements, span);
			}
			case "principle":
				return new PrincipleDecl(string(obj, "name", kind), expr(member(obj, "body", kind)), span);
			case "scope":
				return new ScopeDecl(string(obj, "name", kind), items(optArray(obj, "items")), span);
			default:
				throw new JsonParseException("Unknown item kind '" + kind + "'");
		}
	}

	private static VariableDecl variable(JsonObject obj)
	{
		Expr value = obj.has("value") && !obj.get("value").isJsonNull() ? expr(obj.get("value")) : null;
		return new VariableDecl(string(obj, "name", "declaration"), type(member(obj, "type", "declaration")), value, span(obj));
	}

	// --- Types ---

	private static TypeRef type(JsonElement element)
	{
		if (element.isJsonPrimitive())
		{
			String name = element.getAsString();
			Optional<PrimitiveKind> primitive = PrimitiveKind.fromKeyword(name);
			if (primitive.isPresent())
			{
				return new TypeRef.Primitive(primitive.get(), Span.NONE);
			}
			return new TypeRef.Named(name, Span.NONE);
		}

		JsonObject obj = asObject(element, "type");
		String kind = kind(obj);
		Span span = span(obj);
		switch (kind)
		{
			case "primitive":
			{
				String name = string(obj, "name", kind);
				PrimitiveKind primitive = PrimitiveKind.fromKeyword(name)
						.orElseThrow(() -> new JsonParseException("Unknown primitive type '" + name + "'"));
				return new TypeRef.Primitive(primitive, span);
			}
			case "named":
				return new TypeRef.Named(string(obj, "name", kind), span);
			case "generic":
			{
				List<TypeRef> args = new ArrayList<>();
				for (JsonElement a : array(obj, "args", kind))
				{
					args.add(type(a));
				}
				return new TypeRef.Generic(string(obj, "name", kind), args, span);
			}
			case "typeVar":
				return new TypeRef.TypeVariable(string(obj, "name", kind), span);
			case "bounded":
			{
				TypeRef base = obj.has("base") ? type(obj.get("base")) : new TypeRef.Primitive(PrimitiveKind.INT, span);
				return new TypeRef.Bounded(base, optDecimal(obj, "lower"), optDecimal(obj, "upper"), span);
			}
			case "positive":
				return new TypeRef.Positive(type(member(obj, "inner", kind)), span);
			case "nonEmpty":
				return new TypeRef.NonEmpty(type(member(obj, "inner", kind)), span);
			case "array":
				return new TypeRef.Array(type(member(obj, "element", kind)), span);
			case "union":
				return new TypeRef.Union(type(member(obj, "left", kind)), type(member(obj, "right", kind)), span);
			case "citation":
				return new TypeRef.Citation(optString(obj, "section").orElse(""), optString(obj, "subsection").orElse(""),
						optString(obj, "act").orElse(""), span);
			case "temporal":
				return new TypeRef.Temporal(type(member(obj, "inner", kind)), optString(obj, "validFrom").orElse(null),
						optString(obj, "validUntil").orElse(null), span);
			case "validDate":
				return new TypeRef.ValidDate(optString(obj, "after").orElse(null), optString(obj, "before").orElse(null), span);
			case "money":
				return new TypeRef.Money(string(obj, "currency", kind), span);
			default:
				throw new JsonParseException("Unknown type kind '" + kind + "'");
		}
	}

	// --- Constraints ---

	private static List<Constraint> constraints(JsonArray array)
	{
		List<Constraint> constraints = new ArrayList<>();
		for (JsonElement element : array)
		{
			constraints.add(constraint(element));
		}
		return constraints;
	}

	private static Constraint constraint(JsonElement element)
	{
		JsonObject obj = asObject(element, "constraint");
		String kind = kind(obj);
		Span span = span(obj);
		switch (kind)
		{
			case ">":
			case "<":
			case ">=":
			case "<=":
			case "==":
			case "!=":
				return new Constraint.Comparison(Constraint.Comparator.fromSymbol(kind), expr(member(obj, "value", kind)), span);
			case "range":
				return new Constraint.InRange(expr(member(obj, "min", kind)), expr(member(obj, "max", kind)), span);
			case "and":
				return new Constraint.And(constraint(member(obj, "left", kind)), constraint(member(obj, "right", kind)), span);
			case "or":
				return new Constraint.Or(constraint(member(obj, "left", kind)), constraint(member(obj, "right", kind)), span);
			case "not":
				return new Constraint.Not(constraint(member(obj, "inner", kind)), span);
			case "before":
				return new Constraint.Before(expr(member(obj, "date", kind)), span);
			case "after":
				return new Constraint.After(expr(member(obj, "date", kind)), span);
			case "between":
				return new Constraint.Between(expr(member(obj, "start", kind)), expr(member(obj, "end", kind)), span);
			case "custom":
				return new Constraint.Custom(string(obj, "name", kind), span);
			default:
				throw new JsonParseException("Unknown constraint kind '" + kind + "'");
		}
	}

	// --- Expressions ---

	private static List<Expr> exprs(JsonArray array)
	{
		List<Expr> exprs = new ArrayList<>();
		for (JsonElement element : array)
		{
			exprs.add(expr(element));
		}
		return exprs;
	}

	private static Expr expr(JsonElement element)
	{
		JsonObject obj = asObject(element, "expression");
		String kind = kind(obj);
		Span span = span(obj);
		switch (kind)
		{
			case "int":
			case "float":
			case "bool":
			case "string":
			case "money":
			case "percent":
			case "date":
			case "duration":
				return new Expr.Literal(Expr.LiteralKind.valueOf(kind.toUpperCase(Locale.ROOT)), string(obj, "value", kind), span);
			case "pass":
				return new Expr.Literal(Expr.LiteralKind.PASS, "pass", span);
			case "ident":
				return new Expr.Identifier(string(obj, "name", kind), span);
			case "binary":
				return new Expr.Binary(Expr.BinaryOp.fromSymbol(string(obj, "op", kind)), expr(member(obj, "left", kind)),
						expr(member(obj, "right", kind)), span);
			case "unary":
			{
				String op = string(obj, "op", kind);
				Expr.UnaryOp unary = switch (op)
				{
					case "!" -> Expr.UnaryOp.NOT;
					case "-" -> Expr.UnaryOp.NEG;
					default -> throw new JsonParseException("Unknown unary operator '" + op + "'");
				};
				return new Expr.Unary(unary, expr(member(obj, "operand", kind)), span);
			}
			case "call":
				return new Expr.Call(string(obj, "function", kind), exprs(optArray(obj, "args")), span);
			case "field":
				return new Expr.FieldAccess(expr(member(obj, "target", kind)), string(obj, "field", kind), span);
			case "structInit":
			{
				List<Expr.FieldInit> fields = new ArrayList<>();
				for (JsonElement f : optArray(obj, "fields"))
				{
					JsonObject field = asObject(f, "field initializer");
					fields.add(new Expr.FieldInit(string(field, "name", "field initializer"),
							expr(member(field, "value", "field initializer")), span(field)));
				}
				return new Expr.StructInit(string(obj, "type", kind), fields, span);
			}
			case "match":
			{
				List<Expr.MatchArm> arms = new ArrayList<>();
				for (JsonElement a : array(obj, "arms", kind))
				{
					JsonObject arm = asObject(a, "match arm");
					arms.add(new Expr.MatchArm(pattern(member(arm, "pattern", "match arm")), optExpr(arm, "guard"),
							expr(member(arm, "consequence", "match arm")), span(arm)));
				}
				return new Expr.Match(expr(member(obj, "scrutinee", kind)), arms, span);
			}
			case "forall":
			case "exists":
				return new Expr.Quantified(kind.equals("forall") ? Expr.QuantifierKind.FORALL : Expr.QuantifierKind.EXISTS,
						string(obj, "var", kind), type(member(obj, "type", kind)), expr(member(obj, "body", kind)), span);
			default:
				throw new JsonParseException("Unknown expression kind '" + kind + "'");
		}
	}

	private static Expr optExpr(JsonObject obj, String name)
	{
		return obj.has(name) && !obj.get(name).isJsonNull() ? expr(obj.get(name)) : null;
	}

	private static Pattern pattern(JsonElement element)
	{
		JsonObject obj = asObject(element, "pattern");
		String kind = kind(obj);
		Span span = span(obj);
		switch (kind)
		{
			case "wildcard":
				return new Pattern.Wildcard(span);
			case "binding":
				return new Pattern.Binding(string(obj, "name", kind), span);
			case "satisfies":
				return new Pattern.Satisfies(string(obj, "test", kind), span);
			case "literal":
			{
				Expr value = expr(member(obj, "value", kind));
				if (!(value instanceof Expr.Literal literal))
				{
					throw new JsonParseException("Literal pattern must hold a literal expression");
				}
				return new Pattern.Literal(literal, span);
			}
			default:
				throw new JsonParseException("Unknown pattern kind '" + kind + "'");
		}
	}

	// --- Statements ---

	private static List<Stmt> stmts(JsonArray array)
	{
		List<Stmt> stmts = new ArrayList<>();
		for (JsonElement element : array)
		{
			stmts.add(stmt(element));
		}
		return stmts;
	}

	private static Stmt stmt(JsonElement element)
	{
		JsonObject obj = asObject(element, "statement");
		String kind = kind(obj);
		Span span = span(obj);
		switch (kind)
		{
			case "let":
				return new Stmt.Declare(variable(obj));
			case "assign":
				return new Stmt.Assignment(string(obj, "target", kind), expr(member(obj, "value", kind)), span);
			case "return":
				return new Stmt.Return(optExpr(obj, "value"), span);
			case "match":
			{
				List<Stmt.MatchCase> cases = new ArrayList<>();
				for (JsonElement c : array(obj, "cases", kind))
				{
					JsonObject matchCase = asObject(c, "match case");
					cases.add(new Stmt.MatchCase(pattern(member(matchCase, "pattern", "match case")), optExpr(matchCase, "guard"),
							stmts(optArray(matchCase, "body")), span(matchCase)));
				}
				return new Stmt.Match(expr(member(obj, "scrutinee", kind)), cases, span);
			}
			case "if":
			{
				List<Stmt> elseBranch = obj.has("else") && !obj.get("else").isJsonNull() ? stmts(obj.getAsJsonArray("else")) : null;
				return new Stmt.If(expr(member(obj, "condition", kind)), stmts(optArray(obj, "then")), elseBranch, span);
			}
			case "pass":
				return new Stmt.Pass(span);
			default:
				throw new JsonParseException("Unknown statement kind '" + kind + "'");
		}
	}

	// --- Helpers ---

	private static JsonObject asObject(JsonElement element, String what)
	{
		if (element == null || !element.isJsonObject())
		{
			throw new JsonParseException("Expected an object for " + what + " but got " + element);
		}
		return element.getAsJsonObject();
	}

	private static String kind(JsonObject obj)
	{
		return string(obj, "kind", "node");
	}

	private static JsonElement member(JsonObject obj, String name, String owner)
	{
		JsonElement element = obj.get(name);
		if (element == null || element.isJsonNull())
		{
			throw new JsonParseException("Missing '" + name + "' in " + owner);
		}
		return element;
	}

	private static String string(JsonObject obj, String name, String owner)
	{
		JsonElement element = member(obj, name, owner);
		if (!element.isJsonPrimitive())
		{
			throw new JsonParseException("'" + name + "' in " + owner + " must be a string or number");
		}
		return element.getAsString();
	}

	private static Optional<String> optString(JsonObject obj, String name)
	{
		JsonElement element = obj.get(name);
		if (element == null || element.isJsonNull())
		{
			return Optional.empty();
		}
		return Optional.of(element.getAsString());
	}

	private static boolean optBoolean(JsonObject obj, String name)
	{
		JsonElement element = obj.get(name);
		return element != null && !element.isJsonNull() && element.getAsBoolean();
	}

	private static BigDecimal optDecimal(JsonObject obj, String name)
	{
		JsonElement element = obj.get(name);
		if (element == null || element.isJsonNull())
		{
			return null;
		}
		try
		{
			return new BigDecimal(element.getAsString());
		}
		catch (NumberFormatException e)
		{
			throw new JsonParseException("'" + name + "' must be numeric: " + element, e);
		}
	}

	private static JsonArray array(JsonObject obj, String name, String owner)
	{
		JsonElement element = member(obj, name, owner);
		if (!element.isJsonArray())
		{
			throw new JsonParseException("'" + name + "' in " + owner + " must be an array");
		}
		return element.getAsJsonArray();
	}

	private static JsonArray optArray(JsonObject obj, String name)
	{
		JsonElement element = obj.get(name);
		if (element == null || element.isJsonNull())
		{
			return new JsonArray();
		}
		if (!element.isJsonArray())
		{
			throw new JsonParseException("'" + name + "' must be an array");
		}
		return element.getAsJsonArray();
	}

	private static List<String> strings(JsonArray array)
	{
		List<String> strings = new ArrayList<>();
		for (JsonElement element : array)
		{
			strings.add(element.getAsString());
		}
		return strings;
	}

	private static Span span(JsonObject obj)
	{
		JsonElement element = obj.get("span");
		if (element == null || !element.isJsonObject())
		{
			return Span.NONE;
		}
		JsonObject span = element.getAsJsonObject();
		int line = intOr(span, "line", 0);
		int column = intOr(span, "column", 0);
		return new Span(line, column, intOr(span, "endLine", line), intOr(span, "endColumn", column));
	}

	private static int intOr(JsonObject obj, String name, int fallback)
	{
		JsonElement element = obj.get(name);
		return element == null || element.isJsonNull() ? fallback : element.getAsInt();
	}
}

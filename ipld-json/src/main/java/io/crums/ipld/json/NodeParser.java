/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.ipld.DepthLimitException;
import io.crums.ipld.IpldConstants;
import io.crums.ipld.ListValue;
import io.crums.ipld.Node;
import io.crums.ipld.Scalar;
import io.crums.ipld.Value;

/**
 * {@code Node} JSON parser. This is the decoder that turns JSON into a document
 * tree, and back.
 * 
 * <h2>Numbers</h2>
 * <p>
 * Whole numbers parse as {@code Long}s, others as {@code Double}s (per
 * {@code json.simple}). On output, non-finite floating point numbers are not
 * representable and are rejected.
 * </p>
 */
public class NodeParser implements JsonEntityParser<Node> {
  
  /**
   * Instance with the default max depth.
   */
  public final static NodeParser INSTANCE = new NodeParser();
  
  
  private final int maxDepth;
  
  
  /**
   * Creates an instance with {@linkplain IpldConstants#DEFAULT_MAX_DEPTH}.
   */
  public NodeParser() {
    this(IpldConstants.DEFAULT_MAX_DEPTH);
  }
  
  
  /**
   * @param maxDepth &ge; 1; the top-level value is at depth 1
   */
  public NodeParser(int maxDepth) {
    this.maxDepth = IpldConstants.checkMaxDepth(maxDepth);
  }
  
  
  /** Returns the maximum nesting depth of parsed documents. */
  public int maxDepth() {
    return maxDepth;
  }
  

  @Override
  public Node toEntity(JSONObject jObj) throws JsonParsingException {
    return toValue(jObj).asNode();
  }
  
  
  /**
   * Converts the given {@code json.simple} value to a document value.
   * 
   * @param json  a {@code JSONObject}, {@code JSONArray}, {@code String}, {@code Number},
   *              {@code Boolean}, or {@code null}
   * 
   * @throws JsonParsingException if {@code json} (or a value nested in it) is of any other type,
   *         or if it is nested deeper than {@linkplain #maxDepth()} (the cause, then, is a
   *         {@linkplain DepthLimitException})
   */
  public Value toValue(Object json) throws JsonParsingException {
    try {
      return toValue(json, 1);
    } catch (DepthLimitException dlx) {
      IpldConstants.sysLogger().log(
          Level.WARNING, "JSON conversion aborted: max depth " + maxDepth + " exceeded");
      throw new JsonParsingException("JSON nested too deep: " + dlx.getMessage(), dlx);
    }
  }
  
  
  private Value toValue(Object json, int depth) {
    if (json == null)
      return Scalar.NULL;
    
    else if (depth > maxDepth && (json instanceof Map || json instanceof List))
      throw new DepthLimitException(maxDepth);
    
    else if (json instanceof Map<?,?> jObj) {
      var node = new Node();
      for (var e : jObj.entrySet()) {
        if (!(e.getKey() instanceof String key))
          throw new JsonParsingException("non-string key: " + e.getKey());
        node.put(key, toValue(e.getValue(), depth + 1));
      }
      return node;
    
    } else if (json instanceof List<?> jArray) {
      var list = new ListValue();
      for (var element : jArray)
        list.add(toValue(element, depth + 1));
      return list;
    
    } else if (json instanceof String s)
      return Scalar.of(s);
    
    else if (json instanceof Number num)
      return Scalar.of(num);
    
    else if (json instanceof Boolean bool)
      return Scalar.of(bool.booleanValue());
    
    else
      throw new JsonParsingException(
          "unexpected JSON value type " + json.getClass().getName() + ": " + json);
  }
  
  

  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(Node node, JSONObject jObj) {
    for (var e : node.entries())
      jObj.put(e.getKey(), toJson(e.getValue()));
    return jObj;
  }
  
  
  /**
   * Converts the given document value to its {@code json.simple} equivalent.
   * 
   * @throws IllegalArgumentException
   *         if {@code value} (or a value nested in it) is opaque, or a non-finite number
   */
  @SuppressWarnings("unchecked")
  public Object toJson(Value value) throws IllegalArgumentException {
    return switch (value.getType()) {
    case NODE     -> injectEntity(value.asNode(), new JSONObject());
    case LIST     -> {
      var jArray = new JSONArray();
      for (var element : value.asList().values())
        jArray.add(toJson(element));
      yield jArray;
    }
    case STRING   -> value.asScalar().stringValue();
    case NUMBER   -> checkFinite(value.asScalar().numberValue());
    case BOOLEAN  -> value.asScalar().booleanValue();
    case NULL     -> null;
    case OPAQUE   ->
        throw new IllegalArgumentException("opaque value not representable in JSON: " + value);
    };
  }
  
  
  static Number checkFinite(Number num) {
    if ((num instanceof Double || num instanceof Float) && !Double.isFinite(num.doubleValue()))
      throw new IllegalArgumentException("non-finite number not representable in JSON: " + num);
    return num;
  }

}

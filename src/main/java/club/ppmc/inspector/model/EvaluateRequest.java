/**
 * EvaluateRequest.java
 *
 * 由 ExecutionController 接收的表达式求值请求。
 *
 * @param expression 要在被调试进程中求值的表达式。
 * @param returnByValue 是否按值返回结果。
 */
package club.ppmc.inspector.model;

public record EvaluateRequest(String expression, boolean returnByValue) {}

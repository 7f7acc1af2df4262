/**
 * 요청 컨텍스트 패키지.
 *
 * <p>블로킹 호출에 전달되는 취소/데드라인 신호와, 신호 발화 시 던져지는 예외 계층을 제공합니다.</p>
 *
 * <h2>예외 계층</h2>
 * <pre>
 * ContextDoneException (checked)
 *   ├── RequestCanceledException   : cancel() 호출
 *   └── DeadlineExceededException  : 데드라인 경과
 * </pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.core.context;

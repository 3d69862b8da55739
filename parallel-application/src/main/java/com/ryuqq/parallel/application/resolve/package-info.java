/**
 * 변수 참조({@code ${taskId.path}}) 해석.
 */
package com.ryuqq.parallel.application.resolve;
